package tsubst.model.type;

/**
 * A reference to a declared type parameter. The index is the parameter's position in its
 * declaration, which is also its position in a substitution table built for that
 * declaration.
 */
public class ParamType extends Type {
	private final int index;
	private final String name;

	public ParamType(int index, String name) {
		super(true);
		this.index = index;
		this.name = name;
	}

	public int getIndex() {
		return index;
	}

	public String getName() {
		return name;
	}

	@Override
	public int hashCode() {
		return index * 31 + name.hashCode() * 17 + 2;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof ParamType)) {
			return false;
		}
		ParamType other = (ParamType) obj;
		return index == other.index && name.equals(other.name);
	}

	@Override
	public <T, E extends Throwable> T accept(TypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
