package tsubst.model.type;

import tsubst.errors.Context;
import tsubst.errors.ContextVisitor;
import tsubst.util.SourceLocation;

public class AtSourceLocation extends Context {

	private final SourceLocation location;

	public AtSourceLocation(SourceLocation location) {
		this.location = location;
	}

	public SourceLocation getLocation() {
		return location;
	}

	@Override
	public <T, E extends Throwable> T accept(ContextVisitor<T, E> ctx) throws E {
		return ctx.visit(this);
	}

}
