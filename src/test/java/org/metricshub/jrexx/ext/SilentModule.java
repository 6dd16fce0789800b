package org.metricshub.jrexx.ext;

/**
 * A module whose detection entry point declares nothing.
 */
public class SilentModule implements RexxModule {

	@Override
	public ModuleMetadata describe() {
		return null;
	}
}
