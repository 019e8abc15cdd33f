package com.scholary.transcriber.transcription;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Maps requested model sizes onto the sizes the recognition server can load.
 *
 * <p>Version-suffixed and distilled variants collapse to their base size:
 *
 * <pre>
 * large-v1, large-v2, large-v3, v2, v3  -> large
 * large-v3-turbo, turbo                 -> large
 * tiny.en, base.en, small.en, medium.en -> tiny, base, small, medium
 * </pre>
 */
public final class ModelSizes {

  public static final Set<String> SUPPORTED = Set.of("tiny", "base", "small", "medium", "large");

  private static final Map<String, String> ALIASES =
      Map.of(
          "large-v1", "large",
          "large-v2", "large",
          "large-v3", "large",
          "v2", "large",
          "v3", "large",
          "large-v3-turbo", "large",
          "turbo", "large");

  private ModelSizes() {}

  /**
   * Resolve a requested size.
   *
   * @param requested the size from the job, may be null
   * @param defaultSize used for blank or unknown sizes
   * @return a member of {@link #SUPPORTED}
   */
  public static String resolve(String requested, String defaultSize) {
    if (requested == null || requested.isBlank()) {
      return defaultSize;
    }
    String size = requested.trim().toLowerCase(Locale.ROOT);
    if (size.endsWith(".en")) {
      size = size.substring(0, size.length() - 3);
    }
    if (SUPPORTED.contains(size)) {
      return size;
    }
    String alias = ALIASES.get(size);
    return alias != null ? alias : defaultSize;
  }

  public static boolean isKnown(String requested) {
    if (requested == null || requested.isBlank()) {
      return true;
    }
    String size = requested.trim().toLowerCase(Locale.ROOT);
    if (size.endsWith(".en")) {
      size = size.substring(0, size.length() - 3);
    }
    return SUPPORTED.contains(size) || ALIASES.containsKey(size);
  }
}
