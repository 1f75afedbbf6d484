package tsubst.formatters;

import tsubst.model.region.*;

import java.io.IOException;

public class RegionFormattingVisitor extends RegionVisitor<Void, IOException> {
	private final IndentingWriter out;

	public RegionFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(StaticRegion staticRegion) throws IOException {
		out.write("'static");
		return null;
	}

	@Override
	public Void visit(EarlyBoundRegion earlyBoundRegion) throws IOException {
		out.write("'");
		out.write(earlyBoundRegion.getName());
		return null;
	}

	@Override
	public Void visit(LateBoundRegion lateBoundRegion) throws IOException {
		out.write("'");
		out.write(lateBoundRegion.getName());
		return null;
	}

	@Override
	public Void visit(FreeRegion freeRegion) throws IOException {
		out.write("'");
		out.write(freeRegion.getName());
		out.write("#");
		out.write(Integer.toString(freeRegion.getScopeId()));
		return null;
	}
}
