package org.metricshub.jrexx.ext;

/**
 * Depends on {@link CycleSecondModule}, which depends back on this one.
 */
public class CycleFirstModule implements RexxModule {

	@Override
	public ModuleMetadata describe() {
		return ModuleMetadata.builder("test/cycle-a").dependencies(CycleSecondModule.class.getName()).build();
	}
}
