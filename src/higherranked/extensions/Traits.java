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
package higherranked.extensions;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import higherranked.core.CombineFields;
import higherranked.core.HigherRanked;
import higherranked.core.InferenceContext;
import higherranked.core.Syntax.Binder;
import higherranked.core.Syntax.Instantiation;
import higherranked.core.Syntax.Relatable;
import higherranked.core.Syntax.Type;
import higherranked.core.TypeError;
import higherranked.core.TypeRelation;
import higherranked.util.TypeFolder;

/**
 * Extends the type language with trait references and impls, and provides the
 * matching of (possibly higher-ranked) trait obligations against impls.
 *
 * @author David J. Pearce
 *
 */
public class Traits {
	/**
	 * Enable or disable debugging output.
	 */
	private static final boolean DEBUG = false;

	/**
	 * Extensions to the core syntax of the language.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Syntax {

		/**
		 * Represents a reference to a trait applied to some types, such as
		 * <code>Fn(&amp;'a int, &amp;'a int)</code>. All arguments are invariant.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static class TraitRef implements Relatable<TraitRef> {
			private final String name;
			private final Type[] arguments;

			public TraitRef(String name, Type... arguments) {
				this.name = name;
				this.arguments = arguments;
			}

			public String getName() {
				return name;
			}

			public Type[] getArguments() {
				return arguments;
			}

			@Override
			public TraitRef fold(TypeFolder folder, int depth) {
				Type[] args = new Type[arguments.length];
				for (int i = 0; i != args.length; ++i) {
					args[i] = arguments[i].fold(folder, depth);
				}
				return new TraitRef(name, args);
			}

			@Override
			public TraitRef relate(TypeRelation relation, TraitRef other) {
				if (!name.equals(other.name)) {
					throw TypeError.expectedFound(TypeError.Kind.TRAIT_MISMATCH, relation.aIsExpected(), this, other);
				} else if (arguments.length != other.arguments.length) {
					throw TypeError.expectedFound(TypeError.Kind.ARGUMENT_COUNT, relation.aIsExpected(),
							arguments.length, other.arguments.length);
				}
				Type[] args = new Type[arguments.length];
				for (int i = 0; i != args.length; ++i) {
					args[i] = relation.relateWithVariance(TypeRelation.Variance.INVARIANT, arguments[i],
							other.arguments[i]);
				}
				return new TraitRef(name, args);
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof TraitRef) {
					TraitRef t = (TraitRef) o;
					return name.equals(t.name) && Arrays.equals(arguments, t.arguments);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return name.hashCode() ^ Arrays.hashCode(arguments);
			}

			@Override
			public String toString() {
				return name + "(" + higherranked.core.Syntax.join(arguments) + ")";
			}
		}

		/**
		 * Represents an implementation of a trait, such as
		 * <code>impl&lt;A, R&gt; Fn(A, R) where Clone(A)</code>.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static class Impl {
			private final String[] parameters;
			private final TraitRef header;
			private final TraitRef[] predicates;

			public Impl(String[] parameters, TraitRef header, TraitRef... predicates) {
				this.parameters = parameters;
				this.header = header;
				this.predicates = predicates;
			}

			/**
			 * Get the type parameters declared for this impl.
			 *
			 * @return
			 */
			public String[] getParameters() {
				return parameters;
			}

			/**
			 * Get the trait reference this impl provides.
			 *
			 * @return
			 */
			public TraitRef getHeader() {
				return header;
			}

			/**
			 * Get the where clauses which must hold for this impl to apply.
			 *
			 * @return
			 */
			public TraitRef[] getPredicates() {
				return predicates;
			}

			@Override
			public String toString() {
				String r = "impl";
				if (parameters.length > 0) {
					r += "<" + higherranked.core.Syntax.join(parameters) + ">";
				}
				r += " " + header;
				if (predicates.length > 0) {
					r += " where " + higherranked.core.Syntax.join(predicates);
				}
				return r;
			}
		}
	}

	/**
	 * Matches trait obligations against impls. A higher-ranked obligation matches
	 * an impl only if it does so for every choice of its bound regions. In that
	 * case, the impl's where clauses become obligations quantified in the same
	 * way.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Matcher {
		private final InferenceContext infcx;

		public Matcher(InferenceContext infcx) {
			this.infcx = infcx;
		}

		/**
		 * Match an obligation against an impl, producing the nested obligations that
		 * arise from its where clauses.
		 *
		 * @param obligation
		 * @param impl
		 * @return
		 */
		public List<Binder<Syntax.TraitRef>> match(Binder<Syntax.TraitRef> obligation, Syntax.Impl impl) {
			if (DEBUG) {
				System.err.println("match(" + obligation + ", " + impl + ")");
			}
			return infcx.commitIfOk(snapshot -> {
				Instantiation<Syntax.TraitRef> skol = HigherRanked.skolemizeLateBoundRegions(infcx, obligation,
						snapshot);
				Map<String, Type> substitution = new HashMap<>();
				for (String p : impl.getParameters()) {
					substitution.put(p, infcx.nextTypeVariable());
				}
				Syntax.TraitRef header = substitute(impl.getHeader(), substitution);
				new CombineFields(infcx, true).equate().relate(skol.value(), header);
				HigherRanked.Leak leak = HigherRanked.leakCheck(infcx, skol.map(), snapshot);
				if (leak != null) {
					throw TypeError.insufficientPolymorphism(leak.boundRegion(), leak.region());
				}
				ArrayList<Binder<Syntax.TraitRef>> obligations = new ArrayList<>();
				for (Syntax.TraitRef predicate : impl.getPredicates()) {
					Binder<Syntax.TraitRef> p = new Binder<>(substitute(predicate, substitution));
					obligations.add(HigherRanked.plugLeaks(infcx, skol.map(), snapshot, p));
				}
				if (DEBUG) {
					System.err.println("match: obligations=" + obligations);
				}
				return obligations;
			});
		}
	}

	/**
	 * Replace type parameters in a trait reference according to a given
	 * substitution.
	 *
	 * @param ref
	 * @param substitution
	 * @return
	 */
	public static Syntax.TraitRef substitute(Syntax.TraitRef ref, Map<String, Type> substitution) {
		return ref.fold(new TypeFolder() {
			@Override
			public Type fold(Type.Parameter type, int depth) {
				return substitution.getOrDefault(type.name(), type);
			}
		}, 1);
	}
}
