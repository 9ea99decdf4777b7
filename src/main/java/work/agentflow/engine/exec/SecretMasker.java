package work.agentflow.engine.exec;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Replaces secret values with {@value #MASK} in anything that gets logged or persisted.
 */
public final class SecretMasker {
    public static final String MASK = "***";
    private static final SecretMasker NONE = new SecretMasker(List.of());

    private final List<String> secrets;

    public SecretMasker(Collection<String> values) {
        var sorted = new ArrayList<String>();
        for (var value : values) {
            if (value != null && !value.isEmpty()) {
                sorted.add(value);
            }
        }
        sorted.sort(Comparator.comparingInt(String::length).reversed());
        this.secrets = List.copyOf(sorted);
    }

    public static SecretMasker none() {
        return NONE;
    }

    public String mask(String text) {
        if (text == null || secrets.isEmpty()) {
            return text;
        }
        var masked = text;
        for (var secret : secrets) {
            masked = masked.replace(secret, MASK);
        }
        return masked;
    }

    public List<String> mask(List<String> values) {
        var masked = new ArrayList<String>(values.size());
        for (var value : values) {
            masked.add(mask(value));
        }
        return masked;
    }

    public Map<String, Object> maskDetails(Map<String, Object> details) {
        var masked = new LinkedHashMap<String, Object>();
        for (var entry : details.entrySet()) {
            var value = entry.getValue();
            masked.put(entry.getKey(), value instanceof String text ? mask(text) : value);
        }
        return masked;
    }
}
