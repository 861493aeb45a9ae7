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

import static higherranked.testing.SubtypingTests.parse;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.IOException;
import java.util.Map;

import org.junit.jupiter.api.Test;

import higherranked.core.HigherRanked;
import higherranked.core.InferenceContext;
import higherranked.core.RegionStore;
import higherranked.core.Syntax.Binder;
import higherranked.core.Syntax.BoundRegion;
import higherranked.core.Syntax.Instantiation;
import higherranked.core.Syntax.Region;
import higherranked.core.Syntax.Signature;
import higherranked.core.Syntax.Type;
import higherranked.util.InternalFailure;

public class LeakCheckTests {

	// =================================================================
	// Skolemization
	// =================================================================

	@Test
	public void test_01() throws IOException {
		InferenceContext infcx = new InferenceContext();
		Binder<Signature> b = signature(infcx, "for<'a, 'b> fn(&'a int, &'b int, &'a int)");
		infcx.probe(s -> {
			Instantiation<Signature> i = HigherRanked.skolemizeLateBoundRegions(infcx, b, s);
			Map<BoundRegion, Region> map = i.map();
			assertEquals(2, map.size());
			assertTrue(map.get(BoundRegion.named("a")) instanceof Region.Skolemized);
			assertTrue(map.get(BoundRegion.named("b")) instanceof Region.Skolemized);
			Type[] ps = i.value().parameters();
			assertEquals(map.get(BoundRegion.named("a")), ((Type.Reference) ps[0]).region());
			assertEquals(map.get(BoundRegion.named("b")), ((Type.Reference) ps[1]).region());
			assertEquals(map.get(BoundRegion.named("a")), ((Type.Reference) ps[2]).region());
			return null;
		});
	}

	@Test
	public void test_02() throws IOException {
		// Placeholders never outlive their snapshot, so numbering restarts
		InferenceContext infcx = new InferenceContext();
		Binder<Signature> b = signature(infcx, "for<'a> fn(&'a int)");
		Region first = infcx.probe(s -> skolemize(infcx, b, s).get(BoundRegion.named("a")));
		Region second = infcx.probe(s -> skolemize(infcx, b, s).get(BoundRegion.named("a")));
		assertEquals(first, second);
	}

	@Test
	public void test_03() throws IOException {
		InferenceContext infcx = new InferenceContext();
		Binder<Signature> b = signature(infcx, "for<'a> fn(&'a int)");
		InferenceContext.Snapshot s = infcx.begin();
		s.close();
		try {
			HigherRanked.skolemizeLateBoundRegions(infcx, b, s);
			fail("cannot skolemize outside a snapshot");
		} catch (InternalFailure e) {
			// expected
		}
	}

	@Test
	public void test_04() throws IOException {
		// Nested binders are left alone
		InferenceContext infcx = new InferenceContext();
		Binder<Signature> b = signature(infcx, "for<'a> fn(for<'b> fn(&'b int), &'a int)");
		infcx.probe(s -> {
			Instantiation<Signature> i = HigherRanked.skolemizeLateBoundRegions(infcx, b, s);
			assertEquals(1, i.map().size());
			Type.Function inner = (Type.Function) i.value().parameters()[0];
			Region r = ((Type.Reference) inner.signature().body().parameters()[0]).region();
			assertEquals(new Region.Bound(1, BoundRegion.named("b")), r);
			return null;
		});
	}

	// =================================================================
	// Leak Check
	// =================================================================

	@Test
	public void test_05() throws IOException {
		InferenceContext infcx = new InferenceContext();
		Binder<Signature> b = signature(infcx, "for<'a> fn(&'a int)");
		infcx.probe(s -> {
			Instantiation<Signature> i = HigherRanked.skolemizeLateBoundRegions(infcx, b, s);
			assertNull(HigherRanked.leakCheck(infcx, i.map(), s));
			return null;
		});
	}

	@Test
	public void test_06() throws IOException {
		InferenceContext infcx = new InferenceContext();
		Binder<Signature> b = signature(infcx, "for<'a> fn(&'a int)");
		infcx.probe(s -> {
			Instantiation<Signature> i = HigherRanked.skolemizeLateBoundRegions(infcx, b, s);
			Region skol = i.map().get(BoundRegion.named("a"));
			infcx.regions().makeSubRegion(skol, new Region.Free("x"));
			HigherRanked.Leak leak = HigherRanked.leakCheck(infcx, i.map(), s);
			assertNotNull(leak);
			assertEquals(BoundRegion.named("a"), leak.boundRegion());
			assertEquals(new Region.Free("x"), leak.region());
			return null;
		});
	}

	@Test
	public void test_07() throws IOException {
		// Variables created within the snapshot do not leak
		InferenceContext infcx = new InferenceContext();
		Binder<Signature> b = signature(infcx, "for<'a> fn(&'a int)");
		infcx.probe(s -> {
			Instantiation<Signature> i = HigherRanked.skolemizeLateBoundRegions(infcx, b, s);
			Region skol = i.map().get(BoundRegion.named("a"));
			Region v = infcx.nextRegionVariable();
			infcx.regions().makeSubRegion(v, skol);
			infcx.regions().makeSubRegion(skol, v);
			assertNull(HigherRanked.leakCheck(infcx, i.map(), s));
			return null;
		});
	}

	@Test
	public void test_08() throws IOException {
		// Variables created before the snapshot do leak
		InferenceContext infcx = new InferenceContext();
		Binder<Signature> b = signature(infcx, "for<'a> fn(&'a int)");
		Region v = infcx.nextRegionVariable();
		infcx.probe(s -> {
			Instantiation<Signature> i = HigherRanked.skolemizeLateBoundRegions(infcx, b, s);
			Region skol = i.map().get(BoundRegion.named("a"));
			infcx.regions().makeSubRegion(v, skol);
			HigherRanked.Leak leak = HigherRanked.leakCheck(infcx, i.map(), s);
			assertNotNull(leak);
			assertEquals(v, leak.region());
			return null;
		});
	}

	@Test
	public void test_09() throws IOException {
		// Two placeholders related to each other
		InferenceContext infcx = new InferenceContext();
		Binder<Signature> b = signature(infcx, "for<'a, 'b> fn(&'a int, &'b int)");
		infcx.probe(s -> {
			Instantiation<Signature> i = HigherRanked.skolemizeLateBoundRegions(infcx, b, s);
			Region sa = i.map().get(BoundRegion.named("a"));
			Region sb = i.map().get(BoundRegion.named("b"));
			Region v = infcx.nextRegionVariable();
			infcx.regions().makeSubRegion(sa, v);
			infcx.regions().makeSubRegion(v, sb);
			HigherRanked.Leak leak = HigherRanked.leakCheck(infcx, i.map(), s);
			assertNotNull(leak);
			assertEquals(BoundRegion.named("a"), leak.boundRegion());
			assertEquals(sb, leak.region());
			return null;
		});
	}

	@Test
	public void test_10() throws IOException {
		// A variable hidden inside a type variable which predates the snapshot
		InferenceContext infcx = new InferenceContext();
		Binder<Signature> b = signature(infcx, "for<'a> fn(&'a int)");
		Type.Variable t = infcx.nextTypeVariable();
		infcx.probe(s -> {
			Instantiation<Signature> i = HigherRanked.skolemizeLateBoundRegions(infcx, b, s);
			Region skol = i.map().get(BoundRegion.named("a"));
			Region.Variable v = infcx.nextRegionVariable();
			infcx.typeVariables().instantiate(t, new Type.Reference(v, false, Type.Int));
			infcx.regions().makeSubRegion(v, skol);
			assertTrue(!infcx.regionVarsConfinedToSnapshot(s).contains(v));
			assertNotNull(HigherRanked.leakCheck(infcx, i.map(), s));
			return null;
		});
	}

	// =================================================================
	// Plug Leaks
	// =================================================================

	@Test
	public void test_11() throws IOException {
		InferenceContext infcx = new InferenceContext();
		Binder<Signature> b = signature(infcx, "for<'a> fn(&'a int)");
		Binder<Type> r = infcx.probe(s -> {
			Instantiation<Signature> i = HigherRanked.skolemizeLateBoundRegions(infcx, b, s);
			Type p = i.value().parameters()[0];
			return HigherRanked.plugLeaks(infcx, i.map(), s, new Binder<>(p));
		});
		assertEquals(new Binder<Type>(new Type.Reference(new Region.Bound(1, BoundRegion.named("a")), false, Type.Int)),
				r);
	}

	@Test
	public void test_12() throws IOException {
		// Everything in the taint set is plugged
		InferenceContext infcx = new InferenceContext();
		Binder<Signature> b = signature(infcx, "for<'a> fn(&'a int)");
		Binder<Type> r = infcx.probe(s -> {
			Instantiation<Signature> i = HigherRanked.skolemizeLateBoundRegions(infcx, b, s);
			Region skol = i.map().get(BoundRegion.named("a"));
			Region.Variable v = infcx.nextRegionVariable();
			infcx.regions().makeSubRegion(skol, v);
			Type t = new Type.Tuple(new Type.Reference(v, false, Type.Int), new Type.Reference(skol, false, Type.Int));
			return HigherRanked.plugLeaks(infcx, i.map(), s, new Binder<>(t));
		});
		Region bound = new Region.Bound(1, BoundRegion.named("a"));
		Type expected = new Type.Tuple(new Type.Reference(bound, false, Type.Int),
				new Type.Reference(bound, false, Type.Int));
		assertEquals(new Binder<>(expected), r);
	}

	@Test
	public void test_13() throws IOException {
		// Placeholders are bound by the outermost binder of the value
		InferenceContext infcx = new InferenceContext();
		Binder<Signature> b = signature(infcx, "for<'a> fn(&'a int)");
		Binder<Type> r = infcx.probe(s -> {
			Instantiation<Signature> i = HigherRanked.skolemizeLateBoundRegions(infcx, b, s);
			Type p = i.value().parameters()[0];
			Type f = new Type.Function(new Binder<>(new Signature(new Type[] { p }, Type.Unit)));
			return HigherRanked.plugLeaks(infcx, i.map(), s, new Binder<>(f));
		});
		Type.Function f = (Type.Function) r.body();
		Region region = ((Type.Reference) f.signature().body().parameters()[0]).region();
		assertEquals(new Region.Bound(2, BoundRegion.named("a")), region);
	}

	@Test
	public void test_14() throws IOException {
		// No enclosing binder
		InferenceContext infcx = new InferenceContext();
		Binder<Signature> b = signature(infcx, "for<'a> fn(&'a int)");
		try {
			infcx.probe(s -> {
				Instantiation<Signature> i = HigherRanked.skolemizeLateBoundRegions(infcx, b, s);
				return HigherRanked.plugLeaks(infcx, i.map(), s, i.value().parameters()[0]);
			});
			fail("cannot plug leaks without a binder");
		} catch (InternalFailure e) {
			// expected
		}
	}

	@Test
	public void test_15() throws IOException {
		InferenceContext infcx = new InferenceContext();
		Binder<Signature> b = signature(infcx, "for<'a> fn(&'a int)");
		try {
			infcx.probe(s -> {
				Instantiation<Signature> i = HigherRanked.skolemizeLateBoundRegions(infcx, b, s);
				infcx.regions().makeSubRegion(Region.STATIC, i.map().get(BoundRegion.named("a")));
				return HigherRanked.plugLeaks(infcx, i.map(), s, new Binder<>(i.value().parameters()[0]));
			});
			fail("cannot plug leaks when the leak check fails");
		} catch (InternalFailure e) {
			assertTrue(e.getMessage().startsWith(HigherRanked.PLUG_AFTER_LEAK));
		}
	}

	@Test
	public void test_16() throws IOException {
		// Without checking preconditions, the leak is plugged anyway
		InferenceContext infcx = new InferenceContext(false);
		Binder<Signature> b = signature(infcx, "for<'a> fn(&'a int)");
		Binder<Type> r = infcx.probe(s -> {
			Instantiation<Signature> i = HigherRanked.skolemizeLateBoundRegions(infcx, b, s);
			infcx.regions().makeSubRegion(new Region.Free("x"), i.map().get(BoundRegion.named("a")));
			Type t = new Type.Reference(new Region.Free("x"), false, Type.Int);
			return HigherRanked.plugLeaks(infcx, i.map(), s, new Binder<>(t));
		});
		assertEquals(new Binder<Type>(new Type.Reference(new Region.Bound(1, BoundRegion.named("a")), false, Type.Int)),
				r);
	}

	@Test
	public void test_17() throws IOException {
		// Type variables are resolved before plugging
		InferenceContext infcx = new InferenceContext();
		Binder<Signature> b = signature(infcx, "for<'a> fn(&'a int)");
		Type.Variable t = infcx.nextTypeVariable();
		Binder<Type> r = infcx.probe(s -> {
			Instantiation<Signature> i = HigherRanked.skolemizeLateBoundRegions(infcx, b, s);
			infcx.typeVariables().instantiate(t, i.value().parameters()[0]);
			return HigherRanked.plugLeaks(infcx, i.map(), s, new Binder<Type>(t));
		});
		assertEquals(new Binder<Type>(new Type.Reference(new Region.Bound(1, BoundRegion.named("a")), false, Type.Int)),
				r);
	}

	@Test
	public void test_18() throws IOException {
		InferenceContext infcx = new InferenceContext();
		try {
			infcx.probe(s -> {
				infcx.regions().makeSubRegion(new Region.Bound(1, BoundRegion.named("a")), Region.STATIC);
				return null;
			});
			fail("cannot relate bound regions");
		} catch (InternalFailure e) {
			assertTrue(e.getMessage().startsWith(RegionStore.CANNOT_RELATE_BOUND));
		}
	}

	// =================================================================
	// Helpers
	// =================================================================

	private static Map<BoundRegion, Region> skolemize(InferenceContext infcx, Binder<Signature> b,
			InferenceContext.Snapshot s) {
		return HigherRanked.skolemizeLateBoundRegions(infcx, b, s).map();
	}

	private static Binder<Signature> signature(InferenceContext infcx, String input) throws IOException {
		Type t = parse(infcx, input);
		return ((Type.Function) t).signature();
	}
}
