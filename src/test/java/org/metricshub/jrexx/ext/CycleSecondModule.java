package org.metricshub.jrexx.ext;

/**
 * Depends on {@link CycleFirstModule}.
 */
public class CycleSecondModule implements RexxModule {

	@Override
	public ModuleMetadata describe() {
		return ModuleMetadata.builder("test/cycle-b").dependencies(CycleFirstModule.class.getName()).build();
	}
}
