package org.metricshub.jrexx.ext;

import org.metricshub.jrexx.ext.annotations.ModuleFunction;

/**
 * Module that needs {@link TextModule} loaded first.
 */
public class DependentModule extends AbstractModule {

	public DependentModule() {
		super("test/dependent", "1.0", "Depends on text");
	}

	@ModuleFunction(value = "GREET", params = { "name" })
	public String greet(String name) {
		return "hello " + name;
	}

	@Override
	protected void configure(ModuleMetadata.Builder builder) {
		builder.dependencies("registry:test/text");
	}
}
