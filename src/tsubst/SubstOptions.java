package tsubst;

import org.apache.commons.io.FileUtils;
import org.json.JSONException;
import org.json.JSONObject;
import tsubst.model.subst.Substitution;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.logging.Logger;

// Wraps the options that control how substitution behaves for one compilation phase.
// They are read from the "substitution" object of the JSON configuration file; see
// examples/configs/ for samples.
//
// "regions" selects the phase: "concrete" while region identity still matters (type
// checking), "erased" once it no longer does (code generation). "trace" turns on
// FINER logging of every top-level substitution.
public class SubstOptions {
	private static final Logger logger = Logger.getLogger(SubstOptions.class.getName());

	public static final String SUBSTITUTION_FIELD = "substitution";
	public static final String REGIONS_FIELD = "regions";
	public static final String TRACE_FIELD = "trace";

	public static final String REGIONS_CONCRETE = "concrete";
	public static final String REGIONS_ERASED = "erased";

	private static final String DEFAULT_REGIONS = REGIONS_CONCRETE;

	private final boolean eraseRegions;
	private final boolean traceEnabled;

	private SubstOptions(boolean eraseRegions, boolean traceEnabled) {
		this.eraseRegions = eraseRegions;
		this.traceEnabled = traceEnabled;
	}

	public static SubstOptions defaults() {
		return new SubstOptions(false, false);
	}

	// This expects the JSONObject representing the entire configuration file. A missing
	// "substitution" object means defaults.
	public static SubstOptions fromJSON(JSONObject config) throws SubstOptionException {
		if (!config.has(SUBSTITUTION_FIELD)) {
			return defaults();
		}

		String regions;
		boolean trace;
		try {
			JSONObject substConfig = config.getJSONObject(SUBSTITUTION_FIELD);
			regions = substConfig.has(REGIONS_FIELD) ? substConfig.getString(REGIONS_FIELD) : DEFAULT_REGIONS;
			trace = substConfig.has(TRACE_FIELD) && substConfig.getBoolean(TRACE_FIELD);
		} catch (JSONException e) {
			throw new SubstOptionException("Configuration is invalid: " + e.getMessage(), e);
		}

		switch (regions) {
			case REGIONS_CONCRETE:
				return new SubstOptions(false, trace);
			case REGIONS_ERASED:
				return new SubstOptions(true, trace);
			default:
				throw new SubstOptionException("Invalid region mode: " + regions);
		}
	}

	public static SubstOptions fromFile(File configFile) throws SubstOptionException {
		logger.info("Reading substitution options from \"" + configFile + "\"");
		String contents;
		try {
			contents = FileUtils.readFileToString(configFile, StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new SubstOptionException("Cannot read configuration file " + configFile + ": " + e.getMessage(), e);
		}
		try {
			return fromJSON(new JSONObject(contents));
		} catch (JSONException e) {
			throw new SubstOptionException("Configuration is not valid JSON: " + e.getMessage(), e);
		}
	}

	public boolean isEraseRegions() {
		return eraseRegions;
	}

	public boolean isTraceEnabled() {
		return traceEnabled;
	}

	/**
	 * @return the table to use for items with no generic parameters in this phase
	 */
	public Substitution emptySubstitution() {
		return eraseRegions ? Substitution.erasedEmpty() : Substitution.empty();
	}
}
