// This file is part of the HigherRanked Inference library.
//
// The HigherRanked Inference library is free software; you can
// redistribute it and/or modify it under the terms of the GNU General
// Public License as published by the Free Software Foundation; either
// version 3 of the License, or (at your option) any later version.
//
// The HigherRanked Inference library is distributed in the hope that it
// will be useful, but WITHOUT ANY WARRANTY; without even the
// implied warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR
// PURPOSE. See the GNU General Public License for more details.
//
// You should have received a copy of the GNU General Public
// License along with the HigherRanked Inference library. If not, see
// <http://www.gnu.org/licenses/>
//
// Copyright 2018, David James Pearce.
package higherranked.testing;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import higherranked.core.InferenceContext;
import higherranked.core.RegionStore;
import higherranked.core.Syntax.Region;
import higherranked.core.Syntax.Type;
import higherranked.core.TypeError;
import higherranked.util.InternalFailure;

public class SnapshotTests {

	// =================================================================
	// Commit & Rollback
	// =================================================================

	@Test
	public void test_01() {
		InferenceContext infcx = new InferenceContext();
		try (InferenceContext.Snapshot s = infcx.begin()) {
			infcx.nextRegionVariable();
			infcx.nextTypeVariable();
			s.commit();
		}
		assertEquals(1, infcx.regions().size());
		assertEquals(1, infcx.typeVariables().size());
	}

	@Test
	public void test_02() {
		InferenceContext infcx = new InferenceContext();
		try (InferenceContext.Snapshot s = infcx.begin()) {
			infcx.nextRegionVariable();
			infcx.nextTypeVariable();
		}
		assertEquals(0, infcx.regions().size());
		assertEquals(0, infcx.typeVariables().size());
	}

	@Test
	public void test_03() {
		// An inner commit is undone by an outer rollback
		InferenceContext infcx = new InferenceContext();
		try (InferenceContext.Snapshot outer = infcx.begin()) {
			Region v = infcx.nextRegionVariable();
			try (InferenceContext.Snapshot inner = infcx.begin()) {
				infcx.regions().makeSubRegion(v, new Region.Free("x"));
				infcx.nextRegionVariable();
				inner.commit();
			}
			assertEquals(2, infcx.regions().size());
			assertEquals(1, infcx.regions().constraints().size());
		}
		assertEquals(0, infcx.regions().size());
		assertEquals(0, infcx.regions().constraints().size());
	}

	@Test
	public void test_04() {
		InferenceContext infcx = new InferenceContext();
		Type.Variable t = infcx.nextTypeVariable();
		try (InferenceContext.Snapshot s = infcx.begin()) {
			infcx.typeVariables().instantiate(t, Type.Int);
			assertEquals(Type.Int, infcx.typeVariables().probe(t));
		}
		assertNull(infcx.typeVariables().probe(t));
	}

	@Test
	public void test_05() {
		InferenceContext infcx = new InferenceContext();
		int r = infcx.probe(s -> {
			infcx.nextRegionVariable();
			return infcx.regions().size();
		});
		assertEquals(1, r);
		assertEquals(0, infcx.regions().size());
	}

	@Test
	public void test_06() {
		InferenceContext infcx = new InferenceContext();
		int r = infcx.commitIfOk(s -> {
			infcx.nextRegionVariable();
			return infcx.regions().size();
		});
		assertEquals(1, r);
		assertEquals(1, infcx.regions().size());
	}

	@Test
	public void test_07() {
		InferenceContext infcx = new InferenceContext();
		try {
			infcx.commitIfOk(s -> {
				infcx.nextRegionVariable();
				throw TypeError.expectedFound(TypeError.Kind.MISMATCH, true, Type.Int, Type.Unit);
			});
			fail("expected type error");
		} catch (TypeError e) {
			assertEquals(0, infcx.regions().size());
		}
	}

	@Test
	public void test_08() {
		// Internal failures also roll back
		InferenceContext infcx = new InferenceContext();
		try {
			infcx.commitIfOk(s -> {
				infcx.nextRegionVariable();
				throw new InternalFailure("oops");
			});
			fail("expected internal failure");
		} catch (InternalFailure e) {
			assertEquals(0, infcx.regions().size());
		}
	}

	@Test
	public void test_09() {
		InferenceContext infcx = new InferenceContext();
		InferenceContext.Snapshot outer = infcx.begin();
		InferenceContext.Snapshot inner = infcx.begin();
		try {
			outer.commit();
			fail("snapshots must be closed innermost first");
		} catch (InternalFailure e) {
			// expected
		}
		inner.rollback();
		outer.rollback();
		assertTrue(outer.isClosed());
	}

	@Test
	public void test_10() {
		InferenceContext infcx = new InferenceContext();
		InferenceContext.Snapshot s = infcx.begin();
		s.commit();
		try {
			s.commit();
			fail("cannot commit twice");
		} catch (InternalFailure e) {
			// expected
		}
		// Closing after commit does nothing
		s.close();
	}

	// =================================================================
	// Confinement
	// =================================================================

	@Test
	public void test_11() {
		InferenceContext infcx = new InferenceContext();
		Region before = infcx.nextRegionVariable();
		infcx.probe(s -> {
			Region v1 = infcx.nextRegionVariable();
			Region v2 = infcx.nextRegionVariable();
			Set<Region> confined = infcx.regionVarsConfinedToSnapshot(s);
			assertEquals(2, confined.size());
			assertTrue(confined.contains(v1));
			assertTrue(confined.contains(v2));
			assertFalse(confined.contains(before));
			return null;
		});
	}

	@Test
	public void test_12() {
		InferenceContext infcx = new InferenceContext();
		Type.Variable t = infcx.nextTypeVariable();
		infcx.probe(s -> {
			Region.Variable v1 = infcx.nextRegionVariable();
			Region.Variable v2 = infcx.nextRegionVariable();
			Type.Variable u = infcx.nextTypeVariable();
			infcx.typeVariables().instantiate(t, new Type.Reference(v1, false, Type.Int));
			infcx.typeVariables().instantiate(u, new Type.Reference(v2, false, Type.Int));
			List<Type> escaping = infcx.typeVariables().typesEscaping(s.typeSnapshot());
			assertEquals(1, escaping.size());
			Set<Region> confined = infcx.regionVarsConfinedToSnapshot(s);
			assertFalse(confined.contains(v1));
			assertTrue(confined.contains(v2));
			return null;
		});
	}

	@Test
	public void test_13() {
		// Regions reached through a chain of variables also escape
		InferenceContext infcx = new InferenceContext();
		Type.Variable t = infcx.nextTypeVariable();
		infcx.probe(s -> {
			Region.Variable v = infcx.nextRegionVariable();
			Type.Variable u = infcx.nextTypeVariable();
			infcx.typeVariables().instantiate(t, new Type.Tuple(u, Type.Int));
			infcx.typeVariables().instantiate(u, new Type.Reference(v, false, Type.Int));
			assertFalse(infcx.regionVarsConfinedToSnapshot(s).contains(v));
			return null;
		});
	}

	@Test
	public void test_14() {
		InferenceContext infcx = new InferenceContext();
		Type.Variable t = infcx.nextTypeVariable();
		infcx.typeVariables().instantiate(t, Type.Int);
		try {
			infcx.typeVariables().instantiate(t, Type.Unit);
			fail("cannot instantiate a variable twice");
		} catch (InternalFailure e) {
			// expected
		}
	}

	@Test
	public void test_15() {
		InferenceContext infcx = new InferenceContext();
		infcx.probe(s -> {
			Region v = infcx.regions().newVariable(RegionStore.Origin.MISC);
			List<Integer> created = infcx.regions().varsCreatedSince(s.regionSnapshot());
			assertEquals(1, created.size());
			assertEquals(v, new Region.Variable(created.get(0)));
			return null;
		});
	}
}
