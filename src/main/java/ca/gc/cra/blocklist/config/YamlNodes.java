package ca.gc.cra.blocklist.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Shape checks for SnakeYAML's untyped node tree. */
final class YamlNodes {

  private YamlNodes() {
    // Utility
  }

  static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " contains non-string key: " + entry.getKey());
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  static List<Object> asList(Object node, String context) {
    if (node == null) {
      return List.of();
    }
    if (!(node instanceof List<?> raw)) {
      throw new IllegalArgumentException(context + " must be a sequence");
    }
    return new ArrayList<>(raw);
  }

  static String asScalar(Object node, String context) {
    if (node == null || node instanceof Map<?, ?> || node instanceof Iterable<?>) {
      throw new IllegalArgumentException(context + " must be a scalar value");
    }
    return node.toString().trim();
  }
}
