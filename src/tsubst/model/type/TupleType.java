package tsubst.model.type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Represents a tuple. The empty tuple is the unit type.
 */
public class TupleType extends Type {
	private final List<Type> elementTypes;

	public TupleType(List<Type> elementTypes) {
		super(anyNeedsSubstitution(elementTypes));
		this.elementTypes = Collections.unmodifiableList(new ArrayList<>(elementTypes));
	}

	public List<Type> getElementTypes() {
		return elementTypes;
	}

	@Override
	public int hashCode() {
		return elementTypes.hashCode() * 17 + 5;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof TupleType)) {
			return false;
		}
		return elementTypes.equals(((TupleType) obj).elementTypes);
	}

	@Override
	public <T, E extends Throwable> T accept(TypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
