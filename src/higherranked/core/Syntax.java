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
package higherranked.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import higherranked.util.TypeFolder;

/**
 * The type language over which higher-ranked relations are computed. Regions
 * and types are both dispatched on an opcode, in the same way as terms are.
 *
 * @author David J. Pearce
 *
 */
public class Syntax {
	public final static int REGION_free = 0;
	public final static int REGION_variable = 1;
	public final static int REGION_bound = 2;
	public final static int REGION_skolemized = 3;

	public final static int TYPE_unit = 10;
	public final static int TYPE_int = 11;
	public final static int TYPE_reference = 12;
	public final static int TYPE_function = 13;
	public final static int TYPE_tuple = 14;
	public final static int TYPE_variable = 15;
	public final static int TYPE_parameter = 16;

	/**
	 * Something which can be rebuilt by a folder. The depth is the de Bruijn depth
	 * at which the value sits, starting at 1 and incremented on entering a binder.
	 *
	 * @author David J. Pearce
	 *
	 * @param <T>
	 */
	public interface Foldable<T> {
		public T fold(TypeFolder folder, int depth);
	}

	/**
	 * Something which can be structurally related against another value of the
	 * same kind.
	 *
	 * @author David J. Pearce
	 *
	 * @param <T>
	 */
	public interface Relatable<T> extends Foldable<T> {
		public T relate(TypeRelation relation, T other);
	}

	/**
	 * Identifies a quantified position within a binder (e.g. the <code>'a</code> in
	 * <code>for&lt;'a&gt; fn(&amp;'a int)</code>).
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class BoundRegion {
		public enum Kind {
			NAMED, ANONYMOUS, FRESH
		}

		private final Kind kind;
		private final String name;
		private final int index;

		private BoundRegion(Kind kind, String name, int index) {
			this.kind = kind;
			this.name = name;
			this.index = index;
		}

		public Kind kind() {
			return kind;
		}

		public String name() {
			return name;
		}

		public int index() {
			return index;
		}

		public static BoundRegion named(String name) {
			return new BoundRegion(Kind.NAMED, name, -1);
		}

		public static BoundRegion anonymous(int index) {
			return new BoundRegion(Kind.ANONYMOUS, null, index);
		}

		public static BoundRegion fresh(int index) {
			return new BoundRegion(Kind.FRESH, null, index);
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof BoundRegion) {
				BoundRegion b = (BoundRegion) o;
				return kind == b.kind && index == b.index && (name == null ? b.name == null : name.equals(b.name));
			}
			return false;
		}

		@Override
		public int hashCode() {
			return kind.hashCode() ^ index ^ (name == null ? 0 : name.hashCode());
		}

		@Override
		public String toString() {
			switch (kind) {
			case NAMED:
				return "'" + name;
			case ANONYMOUS:
				return "'#" + index;
			default:
				return "'_" + index;
			}
		}
	}

	public interface Region extends Relatable<Region> {

		/**
		 * The region which outlives all others.
		 */
		public static final Region.Free STATIC = new Region.Free("static");

		/**
		 * Get the opcode associated with the syntactic form of this region.
		 *
		 * @return
		 */
		public int getOpcode();

		/**
		 * Check whether this region is bound by some enclosing binder.
		 *
		 * @return
		 */
		public boolean isBound();

		public static abstract class AbstractRegion implements Region {
			private final int opcode;

			public AbstractRegion(int opcode) {
				this.opcode = opcode;
			}

			@Override
			public int getOpcode() {
				return opcode;
			}

			@Override
			public boolean isBound() {
				return opcode == REGION_bound;
			}

			@Override
			public Region fold(TypeFolder folder, int depth) {
				return folder.fold(this, depth);
			}

			@Override
			public Region relate(TypeRelation relation, Region other) {
				return relation.regions(this, other);
			}
		}

		/**
		 * A named region which exists independently of the comparison being made,
		 * such as <code>'static</code> or a region parameter of an enclosing function.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static class Free extends AbstractRegion {
			private final String name;

			public Free(String name) {
				super(REGION_free);
				this.name = name;
			}

			public String name() {
				return name;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Free && ((Free) o).name.equals(name);
			}

			@Override
			public int hashCode() {
				return name.hashCode();
			}

			@Override
			public String toString() {
				return "'" + name;
			}
		}

		/**
		 * A region inference variable, resolved later by the constraints recorded
		 * against it.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static class Variable extends AbstractRegion {
			private final int id;

			public Variable(int id) {
				super(REGION_variable);
				this.id = id;
			}

			public int id() {
				return id;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Variable && ((Variable) o).id == id;
			}

			@Override
			public int hashCode() {
				return id;
			}

			@Override
			public String toString() {
				return "'?" + id;
			}
		}

		/**
		 * A region bound by the binder at a given de Bruijn depth, where depth 1 is
		 * the innermost enclosing binder.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static class Bound extends AbstractRegion {
			private final int depth;
			private final BoundRegion region;

			public Bound(int depth, BoundRegion region) {
				super(REGION_bound);
				if (depth < 1) {
					throw new IllegalArgumentException("invalid de Bruijn depth: " + depth);
				}
				this.depth = depth;
				this.region = region;
			}

			public int depth() {
				return depth;
			}

			public BoundRegion region() {
				return region;
			}

			/**
			 * Move this region outwards by a given number of binders.
			 *
			 * @param amount
			 * @return
			 */
			public Bound shift(int amount) {
				return amount == 0 ? this : new Bound(depth + amount, region);
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Bound) {
					Bound b = (Bound) o;
					return depth == b.depth && region.equals(b.region);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return depth ^ region.hashCode();
			}

			@Override
			public String toString() {
				return region.toString();
			}
		}

		/**
		 * An opaque placeholder standing in for a bound region whilst the body of its
		 * binder is examined. It behaves as a free region, but must never escape the
		 * transaction that created it.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static class Skolemized extends AbstractRegion {
			private final int id;
			private final BoundRegion region;

			public Skolemized(int id, BoundRegion region) {
				super(REGION_skolemized);
				this.id = id;
				this.region = region;
			}

			public int id() {
				return id;
			}

			public BoundRegion region() {
				return region;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Skolemized) {
					Skolemized s = (Skolemized) o;
					return id == s.id && region.equals(s.region);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return id ^ region.hashCode();
			}

			@Override
			public String toString() {
				return "'!" + id;
			}
		}
	}

	public interface Type extends Relatable<Type> {

		/**
		 * Get the opcode associated with the syntactic form of this type.
		 *
		 * @return
		 */
		public int getOpcode();

		/**
		 * Constant representing the unit type
		 */
		public static Type Unit = new Unit();
		/**
		 * Constant representing the type int
		 */
		public static Type Int = new Int();

		public static abstract class AbstractType implements Type {
			private final int opcode;

			public AbstractType(int opcode) {
				this.opcode = opcode;
			}

			@Override
			public int getOpcode() {
				return opcode;
			}

			@Override
			public Type fold(TypeFolder folder, int depth) {
				return folder.fold(this, depth);
			}

			@Override
			public Type relate(TypeRelation relation, Type other) {
				return relation.tys(this, other);
			}
		}

		public static class Unit extends AbstractType {
			private Unit() {
				super(TYPE_unit);
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Type.Unit;
			}

			@Override
			public int hashCode() {
				return 0;
			}

			@Override
			public String toString() {
				return "()";
			}
		}

		public static class Int extends AbstractType {
			private Int() {
				super(TYPE_int);
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Type.Int;
			}

			@Override
			public int hashCode() {
				return 1;
			}

			@Override
			public String toString() {
				return "int";
			}
		}

		/**
		 * Represents a reference type, such as <code>&amp;'a int</code> or
		 * <code>&amp;'a mut int</code>.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static class Reference extends AbstractType {
			private final Region region;
			private final boolean mutable;
			private final Type element;

			public Reference(Region region, boolean mutable, Type element) {
				super(TYPE_reference);
				this.region = region;
				this.mutable = mutable;
				this.element = element;
			}

			public Region region() {
				return region;
			}

			public boolean isMutable() {
				return mutable;
			}

			public Type element() {
				return element;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Reference) {
					Reference r = (Reference) o;
					return mutable == r.mutable && region.equals(r.region) && element.equals(r.element);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return region.hashCode() ^ element.hashCode() ^ (mutable ? 1 : 0);
			}

			@Override
			public String toString() {
				return "&" + region + (mutable ? " mut " : " ") + element;
			}
		}

		/**
		 * Represents a function pointer type. Every function type carries a binder
		 * over its signature, though that binder may quantify over nothing.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static class Function extends AbstractType {
			private final Binder<Signature> signature;

			public Function(Binder<Signature> signature) {
				super(TYPE_function);
				this.signature = signature;
			}

			public Binder<Signature> signature() {
				return signature;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Function && ((Function) o).signature.equals(signature);
			}

			@Override
			public int hashCode() {
				return signature.hashCode();
			}

			@Override
			public String toString() {
				return signature.toString();
			}
		}

		public static class Tuple extends AbstractType {
			private final Type[] elements;

			public Tuple(Type... elements) {
				super(TYPE_tuple);
				this.elements = elements;
			}

			public int size() {
				return elements.length;
			}

			public Type get(int i) {
				return elements[i];
			}

			public Type[] toArray() {
				return elements;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Tuple && Arrays.equals(((Tuple) o).elements, elements);
			}

			@Override
			public int hashCode() {
				return Arrays.hashCode(elements);
			}

			@Override
			public String toString() {
				return "(" + join(elements) + ")";
			}
		}

		/**
		 * A type inference variable.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static class Variable extends AbstractType {
			private final int id;

			public Variable(int id) {
				super(TYPE_variable);
				this.id = id;
			}

			public int id() {
				return id;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Variable && ((Variable) o).id == id;
			}

			@Override
			public int hashCode() {
				return id;
			}

			@Override
			public String toString() {
				return "_#" + id;
			}
		}

		/**
		 * A type parameter, such as the <code>A</code> in
		 * <code>impl&lt;A&gt; Clone(A)</code>.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static class Parameter extends AbstractType {
			private final String name;

			public Parameter(String name) {
				super(TYPE_parameter);
				this.name = name;
			}

			public String name() {
				return name;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Parameter && ((Parameter) o).name.equals(name);
			}

			@Override
			public int hashCode() {
				return name.hashCode();
			}

			@Override
			public String toString() {
				return name;
			}
		}
	}

	/**
	 * The parameter and result types of a function.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Signature implements Relatable<Signature> {
		private final Type[] parameters;
		private final Type result;

		public Signature(Type[] parameters, Type result) {
			this.parameters = parameters;
			this.result = result;
		}

		public Type[] parameters() {
			return parameters;
		}

		public Type result() {
			return result;
		}

		@Override
		public Signature fold(TypeFolder folder, int depth) {
			return folder.fold(this, depth);
		}

		@Override
		public Signature relate(TypeRelation relation, Signature other) {
			if (parameters.length != other.parameters.length) {
				throw TypeError.expectedFound(TypeError.Kind.ARGUMENT_COUNT, relation.aIsExpected(),
						parameters.length, other.parameters.length);
			}
			Type[] ps = new Type[parameters.length];
			for (int i = 0; i != ps.length; ++i) {
				ps[i] = relation.relateWithVariance(TypeRelation.Variance.CONTRAVARIANT, parameters[i],
						other.parameters[i]);
			}
			Type r = relation.relate(result, other.result);
			return new Signature(ps, r);
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Signature) {
				Signature s = (Signature) o;
				return result.equals(s.result) && Arrays.equals(parameters, s.parameters);
			}
			return false;
		}

		@Override
		public int hashCode() {
			return Arrays.hashCode(parameters) ^ result.hashCode();
		}

		@Override
		public String toString() {
			String r = "fn(" + join(parameters) + ")";
			if (!(result instanceof Type.Unit)) {
				r += " -> " + result;
			}
			return r;
		}
	}

	/**
	 * A value implicitly quantified over the regions bound at depth 1 within it.
	 *
	 * @author David J. Pearce
	 *
	 * @param <T>
	 */
	public static class Binder<T extends Relatable<T>> implements Relatable<Binder<T>> {
		private final T body;

		public Binder(T body) {
			this.body = body;
		}

		/**
		 * Get the body of this binder, skipping over the quantifier. Any regions bound
		 * by this binder will appear at depth 1 in the result.
		 *
		 * @return
		 */
		public T body() {
			return body;
		}

		@Override
		public Binder<T> fold(TypeFolder folder, int depth) {
			return folder.fold(this, depth);
		}

		@Override
		public Binder<T> relate(TypeRelation relation, Binder<T> other) {
			return relation.binders(this, other);
		}

		/**
		 * Determine the regions quantified by this binder, in order of first
		 * occurrence.
		 *
		 * @return
		 */
		public List<BoundRegion> boundRegions() {
			ArrayList<BoundRegion> regions = new ArrayList<>();
			TypeFolder.foldRegions(body, (r, depth) -> {
				if (r instanceof Region.Bound) {
					Region.Bound b = (Region.Bound) r;
					if (b.depth() == depth && !regions.contains(b.region())) {
						regions.add(b.region());
					}
				}
				return r;
			});
			return regions;
		}

		/**
		 * Replace every region bound by this binder using a given mapping. The mapping
		 * is applied once per distinct bound region, and the map returned records the
		 * replacements in order of first occurrence. A replacement which is itself a
		 * bound region is shifted to account for any binders it ends up beneath.
		 *
		 * @param mapping
		 * @return
		 */
		public Instantiation<T> replaceLateBoundRegions(Function<BoundRegion, Region> mapping) {
			LinkedHashMap<BoundRegion, Region> map = new LinkedHashMap<>();
			T value = TypeFolder.foldRegions(body, (r, depth) -> {
				if (r instanceof Region.Bound && ((Region.Bound) r).depth() == depth) {
					BoundRegion br = ((Region.Bound) r).region();
					Region replacement = map.computeIfAbsent(br, mapping);
					if (replacement instanceof Region.Bound) {
						return ((Region.Bound) replacement).shift(depth - 1);
					}
					return replacement;
				}
				return r;
			});
			return new Instantiation<>(value, map);
		}

		/**
		 * Rename the regions bound by this binder, and by any binders nested within
		 * it, so that they are numbered in order of first occurrence. Two binders are
		 * alpha-equivalent exactly when their anonymisations are equal.
		 *
		 * @return
		 */
		public Binder<T> anonymize() {
			int[] counter = new int[1];
			T value = replaceLateBoundRegions(br -> new Region.Bound(1, BoundRegion.anonymous(counter[0]++))).value();
			return new Binder<>(value.fold(ANONYMIZER, 1));
		}

		public boolean isAlphaEquivalent(Binder<T> other) {
			return anonymize().equals(other.anonymize());
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Binder && ((Binder<?>) o).body.equals(body);
		}

		@Override
		public int hashCode() {
			return body.hashCode();
		}

		@Override
		public String toString() {
			List<BoundRegion> regions = boundRegions();
			if (regions.isEmpty()) {
				return body.toString();
			} else {
				return "for<" + join(regions.toArray()) + "> " + body;
			}
		}

		private static final TypeFolder ANONYMIZER = new TypeFolder() {
			@Override
			public <S extends Relatable<S>> Binder<S> fold(Binder<S> binder, int depth) {
				return binder.anonymize();
			}
		};
	}

	/**
	 * The result of opening a binder: the body with its bound regions replaced, and
	 * the replacement made for each bound region.
	 *
	 * @author David J. Pearce
	 *
	 * @param <T>
	 */
	public static class Instantiation<T> {
		private final T value;
		private final Map<BoundRegion, Region> map;

		public Instantiation(T value, Map<BoundRegion, Region> map) {
			this.value = value;
			this.map = map;
		}

		public T value() {
			return value;
		}

		public Map<BoundRegion, Region> map() {
			return map;
		}

		@Override
		public String toString() {
			return "(" + value + ", " + map + ")";
		}
	}

	public static String join(Object[] items) {
		String r = "";
		for (int i = 0; i != items.length; ++i) {
			if (i != 0) {
				r += ", ";
			}
			r += items[i];
		}
		return r;
	}
}
