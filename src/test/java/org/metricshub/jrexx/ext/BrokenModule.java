package org.metricshub.jrexx.ext;

/**
 * A module whose constructor fails.
 */
public class BrokenModule implements RexxModule {

	public BrokenModule() {
		throw new IllegalStateException("broken on purpose");
	}

	@Override
	public ModuleMetadata describe() {
		return ModuleMetadata.builder("test/broken").build();
	}
}
