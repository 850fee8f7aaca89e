package com.delta.mailverify.pipeline.service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Stage selection for a run. {@code full} stands for all three stages.
 */
public final class PipelineModes {
  public static final String FULL = "full";
  public static final String AUTODISCOVERY = "autodiscovery";
  public static final String GENERATE = "generate";
  public static final String VERIFY = "verify";

  private static final Map<String, List<String>> ALIASES = Map.ofEntries(
      Map.entry("all", List.of(FULL)),
      Map.entry("full", List.of(FULL)),
      Map.entry("everything", List.of(FULL)),
      Map.entry("autodiscovery", List.of(AUTODISCOVERY)),
      Map.entry("discovery", List.of(AUTODISCOVERY)),
      Map.entry("crawl", List.of(AUTODISCOVERY)),
      Map.entry("generate", List.of(GENERATE)),
      Map.entry("generation", List.of(GENERATE)),
      Map.entry("gen", List.of(GENERATE)),
      Map.entry("verify", List.of(VERIFY)),
      Map.entry("verification", List.of(VERIFY)),
      Map.entry("verif", List.of(VERIFY)),
      Map.entry("genverify", List.of(GENERATE, VERIFY)),
      Map.entry("generateverify", List.of(GENERATE, VERIFY)),
      Map.entry("generate_verify", List.of(GENERATE, VERIFY)),
      Map.entry("generation_verify", List.of(GENERATE, VERIFY))
  );

  private PipelineModes() {}

  public static List<String> normalize(String raw) {
    if (raw == null || raw.isBlank()) {
      return List.of(FULL);
    }
    Set<String> out = new LinkedHashSet<>();
    for (String token : raw.trim().toLowerCase(Locale.ROOT).split("[+,\\s]+")) {
      if (token.isEmpty()) {
        continue;
      }
      List<String> canonical = ALIASES.get(token);
      if (canonical == null) {
        out.add(token);
        continue;
      }
      if (canonical.contains(FULL)) {
        return List.of(FULL);
      }
      out.addAll(canonical);
    }
    return out.isEmpty() ? List.of(FULL) : new ArrayList<>(out);
  }

  public static boolean includes(List<String> modes, String stage) {
    return modes.contains(FULL) || modes.contains(stage);
  }
}
