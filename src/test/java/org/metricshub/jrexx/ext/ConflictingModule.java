package org.metricshub.jrexx.ext;

/**
 * Declares a function that {@link TextModule} already provides.
 */
public class ConflictingModule implements RexxModule {

	@Override
	public ModuleMetadata describe() {
		return ModuleMetadata.builder("test/conflict").function("SHOUT", call -> "quiet", "text").build();
	}
}
