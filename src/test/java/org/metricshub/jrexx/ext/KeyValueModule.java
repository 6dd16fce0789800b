package org.metricshub.jrexx.ext;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.metricshub.jrexx.address.AddressInvocation;
import org.metricshub.jrexx.address.AddressReply;
import org.metricshub.jrexx.address.AddressResult;
import org.metricshub.jrexx.address.AddressTarget;

/**
 * Module providing an in-memory key/value address target.
 */
public class KeyValueModule implements RexxModule {

	private final Map<String, String> store = new ConcurrentHashMap<String, String>();

	@Override
	public ModuleMetadata describe() {
		return ModuleMetadata.builder("test/kv").version("0.1").addressTarget(new AddressTarget() {
			@Override
			public String getName() {
				return "kv";
			}

			@Override
			public boolean supportsMethodCall() {
				return true;
			}

			@Override
			public AddressReply handle(AddressInvocation invocation) {
				if (invocation.getKind() == AddressInvocation.Kind.COMMAND) {
					String[] words = invocation.getName().trim().split("\\s+", 2);
					if (words.length == 2) {
						store.put(words[0], words[1]);
						return AddressReply.immediate(AddressResult.success(words[1]));
					}
					return AddressReply.immediate(AddressResult.failure(2, "usage: key value"));
				}
				String value = store.get(invocation.getParameter("arg1"));
				return AddressReply.immediate(value == null ? AddressResult.failure(4, "no key") : AddressResult.success(value));
			}
		}).build();
	}
}
