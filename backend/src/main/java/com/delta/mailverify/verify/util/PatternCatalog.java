package com.delta.mailverify.verify.util;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Canonical local-part patterns built from a person's first and last name.
 */
public final class PatternCatalog {
  public static final String FIRST_DOT_LAST = "first.last";
  public static final String F_DOT_LAST = "f.last";
  public static final String FIRSTL = "firstl";
  public static final String FLAST = "flast";
  public static final String FIRST = "first";
  public static final String LAST = "last";
  public static final String FIRST_UNDERSCORE_LAST = "first_last";
  public static final String FIRST_DASH_LAST = "first-last";
  public static final String FIRSTLAST = "firstlast";

  /** Most common convention first. */
  public static final List<String> PRIORITY = List.of(
      FIRST_DOT_LAST,
      F_DOT_LAST,
      FLAST,
      FIRSTLAST,
      FIRST_UNDERSCORE_LAST,
      FIRST_DASH_LAST,
      FIRSTL,
      FIRST,
      LAST
  );

  private static final int UNKNOWN_PATTERN_OFFSET = 10;
  private static final Set<String> ROLE_ALIASES =
      Set.of("info", "sales", "support", "hello", "marketing", "press", "admin");
  private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]");
  private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");

  private static final Map<String, BiFunction<String, String, String>> BUILDERS = new LinkedHashMap<>();

  static {
    BUILDERS.put(FIRST_DOT_LAST, (fn, ln) -> fn + "." + ln);
    BUILDERS.put(F_DOT_LAST, (fn, ln) -> initial(fn) + "." + ln);
    BUILDERS.put(FIRSTL, (fn, ln) -> fn + initial(ln));
    BUILDERS.put(FLAST, (fn, ln) -> initial(fn) + ln);
    BUILDERS.put(FIRST, (fn, ln) -> fn);
    BUILDERS.put(LAST, (fn, ln) -> ln);
    BUILDERS.put(FIRST_UNDERSCORE_LAST, (fn, ln) -> fn + "_" + ln);
    BUILDERS.put(FIRST_DASH_LAST, (fn, ln) -> fn + "-" + ln);
    BUILDERS.put(FIRSTLAST, (fn, ln) -> fn + ln);
  }

  private PatternCatalog() {}

  public record Candidate(String pattern, String localPart) {}

  public record NameExample(String firstName, String lastName, String localPart) {}

  public record DomainPatternInference(String pattern, double confidence, int samples) {}

  public static String normalizeNamePart(String raw) {
    if (raw == null) {
      return "";
    }
    String folded = Normalizer.normalize(raw, Normalizer.Form.NFKD);
    folded = COMBINING_MARKS.matcher(folded).replaceAll("");
    return NON_ALNUM.matcher(folded.toLowerCase(Locale.ROOT)).replaceAll("");
  }

  public static Optional<String> apply(String pattern, String first, String last) {
    BiFunction<String, String, String> builder = BUILDERS.get(pattern);
    if (builder == null) {
      return Optional.empty();
    }
    String fn = normalizeNamePart(first);
    String ln = normalizeNamePart(last);
    if (!isUsable(pattern, fn, ln)) {
      return Optional.empty();
    }
    return Optional.of(builder.apply(fn, ln));
  }

  /**
   * Local-parts for a name in priority order, de-duplicated. When a preferred pattern is
   * given (for example the domain's inferred convention) it leads the list.
   */
  public static List<Candidate> generate(String first, String last, String preferredPattern) {
    List<String> order = new ArrayList<>(PRIORITY.size() + 1);
    if (preferredPattern != null && BUILDERS.containsKey(preferredPattern)) {
      order.add(preferredPattern);
    }
    for (String pattern : PRIORITY) {
      if (!order.contains(pattern)) {
        order.add(pattern);
      }
    }
    Set<String> seen = new LinkedHashSet<>();
    List<Candidate> candidates = new ArrayList<>();
    for (String pattern : order) {
      apply(pattern, first, last)
          .filter(seen::add)
          .ifPresent(localPart -> candidates.add(new Candidate(pattern, localPart)));
    }
    return candidates;
  }

  public static List<Candidate> generate(String first, String last) {
    return generate(first, last, null);
  }

  /**
   * Replays the builders against a local-part. Returns the highest-priority pattern that
   * reproduces it, or empty when none does.
   */
  public static Optional<String> infer(String localPart, String first, String last) {
    if (localPart == null || localPart.isBlank()) {
      return Optional.empty();
    }
    String target = localPart.trim().toLowerCase(Locale.ROOT);
    for (String pattern : PRIORITY) {
      Optional<String> built = apply(pattern, first, last);
      if (built.isPresent() && built.get().equals(target)) {
        return Optional.of(pattern);
      }
    }
    return Optional.empty();
  }

  public static int priorityOf(String pattern) {
    int index = pattern == null ? -1 : PRIORITY.indexOf(pattern);
    return index >= 0 ? index : PRIORITY.size() + UNKNOWN_PATTERN_OFFSET;
  }

  public static <T> Comparator<T> byPriority(
      Function<T, String> patternOf,
      Function<T, String> localPartOf
  ) {
    return Comparator.<T>comparingInt(item -> priorityOf(patternOf.apply(item)))
        .thenComparing(item -> localPartOf.apply(item) == null ? "" : localPartOf.apply(item));
  }

  /**
   * Picks the domain's dominant pattern from known (first, last, local-part) examples.
   * Needs at least two matches covering 80% of the non-role examples.
   */
  public static DomainPatternInference inferDomainPattern(List<NameExample> examples) {
    List<NameExample> usable = new ArrayList<>();
    for (NameExample example : examples) {
      if (example.localPart() != null
          && !ROLE_ALIASES.contains(example.localPart().toLowerCase(Locale.ROOT))) {
        usable.add(example);
      }
    }
    int samples = usable.size();
    if (samples < 2) {
      return new DomainPatternInference(null, 0.0, samples);
    }
    Map<String, Integer> scores = new LinkedHashMap<>();
    for (String pattern : BUILDERS.keySet()) {
      scores.put(pattern, 0);
    }
    for (NameExample example : usable) {
      String localPart = example.localPart().toLowerCase(Locale.ROOT);
      for (String pattern : BUILDERS.keySet()) {
        if (apply(pattern, example.firstName(), example.lastName()).map(localPart::equals).orElse(false)) {
          scores.merge(pattern, 1, Integer::sum);
        }
      }
    }
    String best = null;
    int hits = 0;
    for (Map.Entry<String, Integer> entry : scores.entrySet()) {
      if (entry.getValue() > hits) {
        best = entry.getKey();
        hits = entry.getValue();
      }
    }
    double confidence = (double) hits / samples;
    if (hits >= 2 && confidence >= 0.80) {
      return new DomainPatternInference(best, confidence, samples);
    }
    return new DomainPatternInference(null, confidence, samples);
  }

  private static boolean isUsable(String pattern, String fn, String ln) {
    return switch (pattern) {
      case FIRST -> !fn.isEmpty();
      case LAST -> !ln.isEmpty();
      default -> !fn.isEmpty() && !ln.isEmpty();
    };
  }

  private static String initial(String value) {
    return value.isEmpty() ? "" : value.substring(0, 1);
  }
}
