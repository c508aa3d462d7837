package ca.gc.cra.taskwerk.domain.config;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Predicate;

/**
 * Helpers for the nested {@code Map<String, Object>} trees that hold layer contents.
 *
 * <p>Trees built here contain only {@link LinkedHashMap} and {@link ArrayList} containers, so callers may
 * mutate them freely; values handed in from outside are copied on the way in.</p>
 *
 * @since 0.1.0
 */
public final class ConfigTrees {

  private ConfigTrees() {}

  /**
   * Creates an empty, insertion-ordered tree.
   *
   * @return new mutable map
   */
  public static Map<String, Object> emptyTree() {
    return new LinkedHashMap<>();
  }

  /**
   * Deep-copies a tree. Nested maps and lists are copied; scalars are shared (they are immutable).
   *
   * @param source tree to copy; {@code null} yields an empty tree
   * @return independent mutable copy
   */
  public static Map<String, Object> deepCopy(Map<String, ?> source) {
    Map<String, Object> copy = new LinkedHashMap<>();
    if (source == null) {
      return copy;
    }
    for (Map.Entry<String, ?> entry : source.entrySet()) {
      copy.put(entry.getKey(), copyValue(entry.getValue()));
    }
    return copy;
  }

  /**
   * Deep-copies a single value. Map keys are stringified and numbers pass through
   * {@link #canonicalNumber(Number)}.
   *
   * @param value map, list or scalar; may be {@code null}
   * @return copy with fresh containers
   */
  public static Object copyValue(Object value) {
    if (value instanceof Map<?, ?> map) {
      Map<String, Object> copy = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        copy.put(String.valueOf(entry.getKey()), copyValue(entry.getValue()));
      }
      return copy;
    }
    if (value instanceof List<?> list) {
      List<Object> copy = new ArrayList<>(list.size());
      for (Object element : list) {
        copy.add(copyValue(element));
      }
      return copy;
    }
    if (value instanceof Number number) {
      return canonicalNumber(number);
    }
    return value;
  }

  /**
   * Narrows a number to the representation the YAML and JSON parsers produce for the same text: whole
   * numbers become the smallest of {@link Integer}, {@link Long} or {@link BigInteger}, and {@link Float}
   * becomes the {@link Double} with the same decimal rendering. Other numbers are returned unchanged.
   *
   * @param number number to narrow
   * @return canonical number
   */
  public static Number canonicalNumber(Number number) {
    if (number instanceof Byte || number instanceof Short) {
      return number.intValue();
    }
    if (number instanceof Long whole) {
      if (whole >= Integer.MIN_VALUE && whole <= Integer.MAX_VALUE) {
        return whole.intValue();
      }
      return whole;
    }
    if (number instanceof BigInteger big) {
      if (big.bitLength() < Integer.SIZE) {
        return big.intValue();
      }
      return big.bitLength() < Long.SIZE ? Long.valueOf(big.longValue()) : big;
    }
    if (number instanceof Float single && Float.isFinite(single)) {
      return Double.valueOf(single.toString());
    }
    return number;
  }

  /**
   * Looks up the value at {@code path}.
   *
   * @param root tree to search
   * @param path typed path
   * @return value when every segment exists; empty for a missing segment or an explicit {@code null}
   */
  public static Optional<Object> find(Map<String, ?> root, ConfigPath path) {
    Objects.requireNonNull(path, "path");
    Object current = root;
    for (String segment : path.segments()) {
      if (!(current instanceof Map<?, ?> map) || !map.containsKey(segment)) {
        return Optional.empty();
      }
      current = map.get(segment);
    }
    return Optional.ofNullable(current);
  }

  /**
   * Stores a copy of {@code value} at {@code path}, creating intermediate maps as needed.
   *
   * @param root tree to mutate
   * @param path typed path
   * @param value value to store; containers are copied
   * @throws IllegalArgumentException when an intermediate segment already holds a non-map value
   */
  public static void put(Map<String, Object> root, ConfigPath path, Object value) {
    Objects.requireNonNull(root, "root");
    Map<String, Object> parent = root;
    List<String> segments = path.segments();
    for (int i = 0; i < segments.size() - 1; i++) {
      String segment = segments.get(i);
      Object next = parent.get(segment);
      if (next == null) {
        Map<String, Object> created = new LinkedHashMap<>();
        parent.put(segment, created);
        parent = created;
      } else if (next instanceof Map<?, ?>) {
        parent = asTree(next);
      } else {
        throw new IllegalArgumentException(
            "cannot set " + path + ": " + String.join(".", segments.subList(0, i + 1)) + " is not an object");
      }
    }
    parent.put(path.leaf(), copyValue(value));
  }

  /**
   * Removes the entry at {@code path}. Parent maps left empty are kept.
   *
   * @param root tree to mutate
   * @param path typed path
   * @return {@code true} when the key existed
   */
  public static boolean remove(Map<String, Object> root, ConfigPath path) {
    Object parent = root;
    Optional<ConfigPath> parentPath = path.parent();
    if (parentPath.isPresent()) {
      parent = find(root, parentPath.get()).orElse(null);
    }
    if (!(parent instanceof Map<?, ?> map) || !map.containsKey(path.leaf())) {
      return false;
    }
    asTree(map).remove(path.leaf());
    return true;
  }

  /**
   * Visits every leaf of the tree. A map is descended into unless {@code declaredLeaf} reports that the
   * schema declares a leaf at that path, in which case the whole map is visited as one value. Keys are taken
   * verbatim, so a visited path may hold segments that {@link ConfigPath#parse} cannot produce.
   *
   * @param root tree to walk
   * @param declaredLeaf schema predicate identifying leaf paths
   * @param visitor receives each leaf path and value
   */
  public static void forEachLeaf(
      Map<String, ?> root, Predicate<ConfigPath> declaredLeaf, BiConsumer<ConfigPath, Object> visitor) {
    if (root == null) {
      return;
    }
    for (Map.Entry<String, ?> entry : root.entrySet()) {
      walk(ConfigPath.ofKey(entry.getKey()), entry.getValue(), declaredLeaf, visitor);
    }
  }

  private static void walk(
      ConfigPath path, Object value, Predicate<ConfigPath> declaredLeaf, BiConsumer<ConfigPath, Object> visitor) {
    if (value instanceof Map<?, ?> map && !declaredLeaf.test(path)) {
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        walk(path.child(String.valueOf(entry.getKey())), entry.getValue(), declaredLeaf, visitor);
      }
      return;
    }
    visitor.accept(path, value);
  }

  /**
   * Views a map node of a tree built by this class as a mutable string-keyed map.
   *
   * @param node map node
   * @return the same instance, typed
   */
  @SuppressWarnings("unchecked")
  public static Map<String, Object> asTree(Object node) {
    if (!(node instanceof Map<?, ?>)) {
      throw new IllegalArgumentException("expected an object but found " + FieldType.describe(node));
    }
    return (Map<String, Object>) node;
  }
}
