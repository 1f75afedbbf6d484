package tsubst.util;

import tsubst.Unreachable;
import tsubst.formatters.IndentingWriter;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * A span of source text that a substitution was requested on behalf of, used only to
 * place diagnostics.
 */
public class SourceLocation {
	private final Path file;
	private final int startLine;
	private final int endLine;
	private final int startColumn;
	private final int endColumn;

	public SourceLocation(Path file, int startLine, int endLine, int startColumn, int endColumn) {
		this.file = file;
		this.startLine = startLine;
		this.endLine = endLine;
		this.startColumn = startColumn;
		this.endColumn = endColumn;
	}

	public void writePretty(IndentingWriter out) {
		try {
			if (isUnknown()) {
				out.write("at unknown source location");
			} else {
				out.write("at ");
				if (startLine != endLine) {
					out.write("" + (startLine + 1) + ":" + (startColumn + 1) + "-" + (endLine + 1) + ":" + endColumn);
				} else if (startColumn != endColumn) {
					out.write("" + (startLine + 1) + ":" + (startColumn + 1) + "-" + endColumn);
				} else {
					out.write("" + (startLine + 1) + ":" + (startColumn + 1));
				}
				out.write(" in file " + file);
			}
		} catch (IOException e) {
			throw new Unreachable(e); // string ops shouldn't throw IO exceptions
		}
	}

	public static SourceLocation unknown() {
		return new SourceLocation(null, -1, -1, -1, -1);
	}

	public boolean isUnknown() {
		return file == null;
	}

	public Path getFile() {
		return file;
	}

	public int getStartLine() {
		return startLine;
	}

	public int getEndLine() {
		return endLine;
	}

	public int getStartColumn() {
		return startColumn;
	}

	public int getEndColumn() {
		return endColumn;
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + endColumn;
		result = prime * result + endLine;
		result = prime * result + ((file == null) ? 0 : file.hashCode());
		result = prime * result + startColumn;
		result = prime * result + startLine;
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null) {
			return false;
		}
		if (getClass() != obj.getClass()) {
			return false;
		}
		SourceLocation other = (SourceLocation) obj;
		return endColumn == other.endColumn && endLine == other.endLine && startColumn == other.startColumn &&
				startLine == other.startLine && Objects.equals(file, other.file);
	}

	@Override
	public String toString() {
		if (isUnknown()) {
			return "SourceLocation [UNKNOWN]";
		} else {
			return "SourceLocation [file=" + file + ", startLine=" + startLine + ", endLine=" + endLine +
					", startColumn=" + startColumn + ", endColumn=" + endColumn + "]";
		}
	}

}
