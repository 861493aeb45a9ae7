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
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.IOException;

import org.junit.jupiter.api.Test;

import higherranked.core.InferenceContext;
import higherranked.core.Syntax.Binder;
import higherranked.core.Syntax.Region;
import higherranked.core.Syntax.Signature;
import higherranked.core.Syntax.Type;
import higherranked.core.TypeError;

public class LubTests {

	@Test
	public void test_01() throws IOException {
		checkLub("for<'a> fn(&'a int)", "for<'b> fn(&'b int)", "for<'a> fn(&'a int)");
	}

	@Test
	public void test_02() throws IOException {
		checkLub("for<'a> fn(&'a int)", "fn(&'static int)", "fn(&'static int)");
	}

	@Test
	public void test_03() throws IOException {
		checkLub("fn(&'static int)", "for<'a> fn(&'a int)", "fn(&'static int)");
	}

	@Test
	public void test_04() throws IOException {
		// Related to a region which predates the computation, so not generalised
		Signature s = checkLub("for<'a> fn(&'a int)", "fn(&'x int)").body();
		Type.Reference p = (Type.Reference) s.parameters()[0];
		assertTrue(p.region() instanceof Region.Variable);
	}

	@Test
	public void test_05() throws IOException {
		checkLub("for<'a> fn(&'a int) -> &'a int", "for<'b> fn(&'b int) -> &'b int",
				"for<'a> fn(&'a int) -> &'a int");
	}

	@Test
	public void test_06() throws IOException {
		checkLub("for<'a> fn(&'a int) -> &'a int", "for<'a> fn(&'a int) -> &'a int",
				"for<'a> fn(&'a int) -> &'a int");
	}

	@Test
	public void test_07() throws IOException {
		checkLub("for<'a, 'b> fn(&'a int, &'b int)", "for<'c, 'd> fn(&'c int, &'d int)",
				"for<'a, 'b> fn(&'a int, &'b int)");
	}

	@Test
	public void test_08() throws IOException {
		// The result is named after the first bound region of the left operand
		Binder<Signature> r = checkLub("for<'a, 'b> fn(&'a int, &'b int)", "for<'c> fn(&'c int, &'c int)");
		Type.Reference p0 = (Type.Reference) r.body().parameters()[0];
		Type.Reference p1 = (Type.Reference) r.body().parameters()[1];
		assertEquals(p0.region(), p1.region());
		assertTrue(p0.region() instanceof Region.Bound);
		assertEquals("'a", ((Region.Bound) p0.region()).region().toString());
	}

	@Test
	public void test_09() throws IOException {
		checkLub("(for<'a> fn(&'a int), int)", "(for<'b> fn(&'b int), int)", "(for<'a> fn(&'a int), int)");
	}

	@Test
	public void test_10() throws IOException {
		checkNotLub("fn(int)", "fn(&'static int)", TypeError.Kind.MISMATCH);
	}

	@Test
	public void test_11() throws IOException {
		checkNotLub("fn(int)", "fn(int, int)", TypeError.Kind.ARGUMENT_COUNT);
	}

	@Test
	public void test_12() throws IOException {
		InferenceContext infcx = new InferenceContext();
		Type a = parse(infcx, "_");
		Type r = infcx.lub(true, a, Type.Int);
		assertEquals(Type.Int, infcx.resolveTypeVarsIfPossible(r));
		assertEquals(Type.Int, infcx.resolveTypeVarsIfPossible(a));
	}

	@Test
	public void test_13() throws IOException {
		checkLub("&'static int", "&'static int", "&'static int");
	}

	@Test
	public void test_14() throws IOException {
		InferenceContext infcx = new InferenceContext();
		Type r = infcx.lub(true, parse(infcx, "&'x int"), parse(infcx, "&'static int"));
		assertEquals(parse(infcx, "&'x int"), r);
	}

	// =================================================================
	// Helpers
	// =================================================================

	public static Binder<Signature> checkLub(String a, String b) throws IOException {
		InferenceContext infcx = new InferenceContext();
		Type t1 = parse(infcx, a);
		Type t2 = parse(infcx, b);
		try {
			Type r = infcx.lub(true, t1, t2);
			return ((Type.Function) r).signature();
		} catch (TypeError e) {
			e.printStackTrace();
			fail("lub(" + a + ", " + b + ") should exist: " + e.getMessage());
			return null; // deadcode
		}
	}

	public static void checkLub(String a, String b, String expected) throws IOException {
		InferenceContext infcx = new InferenceContext();
		Type t1 = parse(infcx, a);
		Type t2 = parse(infcx, b);
		Type t3 = parse(infcx, expected);
		Type r = infcx.lub(true, t1, t2);
		assertEquivalent(t3, r);
	}

	public static void checkNotLub(String a, String b, TypeError.Kind kind) throws IOException {
		InferenceContext infcx = new InferenceContext();
		try {
			infcx.lub(true, parse(infcx, a), parse(infcx, b));
			fail("lub(" + a + ", " + b + ") shouldn't exist");
		} catch (TypeError e) {
			assertEquals(kind, e.kind());
		}
	}

	/**
	 * Check two types are the same, up to renaming of bound regions.
	 *
	 * @param expected
	 * @param actual
	 */
	public static void assertEquivalent(Type expected, Type actual) {
		Binder<Type> e = new Binder<>(expected).anonymize();
		Binder<Type> a = new Binder<>(actual).anonymize();
		assertEquals(e.toString(), a.toString());
		assertEquals(e, a);
	}
}
