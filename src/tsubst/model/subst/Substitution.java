package tsubst.model.subst;

import tsubst.InternalCompilerError;
import tsubst.model.fold.TypeFoldables;
import tsubst.model.fold.TypeFolder;
import tsubst.model.region.Region;
import tsubst.model.type.Type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The values that turn a polymorphic entity into a monomorphic one.
 *
 * Type parameters are indexed in the order in which they were declared. The self type
 * is only present when instantiating something declared relative to Self, such as a
 * trait being matched against its implementing type. Region substitution is described
 * by {@link RegionSubstitution}.
 *
 * Late-bound regions in function signatures are instantiated through a different
 * mechanism and are never touched by a substitution.
 */
public class Substitution implements Substitutable<Substitution> {
	private final Type selfType;
	private final List<Type> typeParams;
	private final RegionSubstitution regions;

	/**
	 * @param selfType   the self type, or null if the instantiated item has none
	 * @param typeParams the type parameters, in declaration order
	 * @param regions    how to substitute early-bound regions
	 */
	public Substitution(Type selfType, List<Type> typeParams, RegionSubstitution regions) {
		this.selfType = selfType;
		this.typeParams = Collections.unmodifiableList(new ArrayList<>(typeParams));
		this.regions = regions;
	}

	public static Substitution empty() {
		return new Substitution(null, Collections.emptyList(), new NonErasedRegions(Collections.emptyList()));
	}

	public static Substitution erasedEmpty() {
		return new Substitution(null, Collections.emptyList(), ErasedRegions.getInstance());
	}

	/**
	 * Erased regions are never a no-op, since erasure may be relied upon to canonicalize
	 * what it is applied to.
	 */
	public boolean isNoop() {
		boolean regionsAreNoop = regions.accept(new RegionSubstitutionVisitor<Boolean, RuntimeException>() {
			@Override
			public Boolean visit(ErasedRegions erasedRegions) {
				return false;
			}

			@Override
			public Boolean visit(NonErasedRegions nonErasedRegions) {
				return nonErasedRegions.getRegions().isEmpty();
			}
		});
		return typeParams.isEmpty() && regionsAreNoop && selfType == null;
	}

	public boolean hasSelfType() {
		return selfType != null;
	}

	/**
	 * Only call this where the self type is known to be present.
	 *
	 * @throws InternalCompilerError if this substitution has no self type
	 */
	public Type getSelfType() {
		if (selfType == null) {
			throw new InternalCompilerError("substitution has no Self type");
		}
		return selfType;
	}

	public Optional<Type> findSelfType() {
		return Optional.ofNullable(selfType);
	}

	public List<Type> getTypeParams() {
		return typeParams;
	}

	public RegionSubstitution getRegions() {
		return regions;
	}

	/**
	 * @return true if any of the values held by this substitution themselves refer to
	 * parameters, so that this substitution changes when substituted into
	 */
	public boolean needsSubstitution() {
		if (selfType != null && selfType.needsSubstitution()) {
			return true;
		}
		for (Type t : typeParams) {
			if (t.needsSubstitution()) {
				return true;
			}
		}
		return regions.needsSubstitution();
	}

	@Override
	public Substitution foldWith(TypeFolder folder) {
		Type foldedSelfType = selfType == null ? null : selfType.foldWith(folder);
		List<Type> foldedTypeParams = TypeFoldables.foldAll(typeParams, folder);
		RegionSubstitution foldedRegions = regions.foldWith(folder);
		if (foldedSelfType == selfType && foldedTypeParams == typeParams && foldedRegions == regions) {
			return this;
		}
		return new Substitution(foldedSelfType, foldedTypeParams, foldedRegions);
	}

	@Override
	public int hashCode() {
		return Objects.hash(selfType, typeParams, regions);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Substitution)) {
			return false;
		}
		Substitution other = (Substitution) obj;
		return Objects.equals(selfType, other.selfType) && typeParams.equals(other.typeParams) &&
				regions.equals(other.regions);
	}

	@Override
	public String toString() {
		return "Substitution [selfType=" + selfType + ", typeParams=" + typeParams + ", regions=" + regions + "]";
	}
}
