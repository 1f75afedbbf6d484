package tsubst.model.region;

import tsubst.Unreachable;
import tsubst.formatters.IndentingWriter;
import tsubst.formatters.RegionFormattingVisitor;
import tsubst.model.fold.TypeFolder;
import tsubst.model.subst.Substitutable;

import java.io.IOException;
import java.io.StringWriter;

/**
 * A lifetime, as it appears inside references and other region-bearing types.
 */
public abstract class Region implements Substitutable<Region> {

	/**
	 * @return true if a substitution table may replace this region
	 */
	public boolean needsSubstitution() {
		return false;
	}

	@Override
	public Region foldWith(TypeFolder folder) {
		return folder.foldRegion(this);
	}

	@Override
	public abstract int hashCode();

	@Override
	public abstract boolean equals(Object obj);

	@Override
	public String toString() {
		StringWriter writer = new StringWriter();
		try {
			this.accept(new RegionFormattingVisitor(new IndentingWriter(writer)));
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return writer.toString();
	}

	public abstract <T, E extends Throwable> T accept(RegionVisitor<T, E> v) throws E;
}
