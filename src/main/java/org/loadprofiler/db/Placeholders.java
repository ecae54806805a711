package org.loadprofiler.db;

import java.time.Instant;
import java.util.List;
import java.util.Random;

/** Expands per-iteration placeholders in benchmark SQL and string parameters. */
final class Placeholders {

  static final List<String> CATEGORIES = List.of("component", "service", "model", "utility", "test");

  private Placeholders() {}

  static String substitute(String template, int iteration, Random random) {
    if (template == null || template.indexOf('{') < 0) {
      return template;
    }
    return template
        .replace("{iteration}", Integer.toString(iteration))
        .replace("{random_id}", Integer.toString(random.nextInt(1000)))
        .replace("{random_category}", CATEGORIES.get(random.nextInt(CATEGORIES.size())))
        .replace("{timestamp}", Instant.now().toString());
  }

  static Object[] substitute(List<Object> parameters, int iteration, Random random) {
    Object[] values = new Object[parameters.size()];
    for (int i = 0; i < values.length; i++) {
      Object parameter = parameters.get(i);
      values[i] =
          parameter instanceof String text ? substitute(text, iteration, random) : parameter;
    }
    return values;
  }
}
