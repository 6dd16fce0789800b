package org.metricshub.jrexx.ext;

import java.math.BigDecimal;
import java.util.Map;
import java.util.TreeMap;
import org.metricshub.jrexx.ext.annotations.ModuleFunction;
import org.metricshub.jrexx.ext.annotations.ModuleOperation;

/**
 * Module used by the loader tests, also listed as a classpath service.
 */
public class TextModule extends AbstractModule {

	public TextModule() {
		super("test/text", "1.2", "Text helpers");
	}

	@ModuleFunction(value = "SHOUT", params = { "text" })
	public String shout(String text) {
		return text.toUpperCase() + "!";
	}

	@ModuleFunction(value = "REPEAT", params = { "text", "count" })
	public String repeat(String text, int count) {
		StringBuilder result = new StringBuilder();
		for (int i = 0; i < count; i++) {
			result.append(text);
		}
		return result.toString();
	}

	@ModuleFunction(value = "TOTAL", params = { "values" })
	public BigDecimal total(BigDecimal... values) {
		BigDecimal sum = BigDecimal.ZERO;
		for (BigDecimal value : values) {
			sum = sum.add(value);
		}
		return sum;
	}

	@ModuleFunction("NOTHING")
	public String nothing() {
		return null;
	}

	@ModuleFunction("EXPLODE")
	public String explode() {
		throw new IllegalStateException("kaboom");
	}

	@ModuleOperation(value = "TAG", params = { "name", "level" }, description = "Formats a tag")
	public String tag(String name, int level, Map<String, Object> extra) {
		return name + "@" + level + new TreeMap<String, Object>(extra);
	}

	@ModuleOperation(value = "CALLINFO")
	public String callInfo(ModuleCall call, String... rest) {
		return call.getName() + ":" + rest.length + ":" + call.getNumeric().getDigits();
	}
}
