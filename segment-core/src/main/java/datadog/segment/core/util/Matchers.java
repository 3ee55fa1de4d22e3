package datadog.segment.core.util;

import java.util.regex.Pattern;

public final class Matchers {
  public static final Matcher ANY = new AnyMatcher();

  private Matchers() {}

  public static Matcher compileGlob(String glob) {
    if (glob == null || isAny(glob)) {
      return ANY;
    } else if (isExact(glob)) {
      return new EqualsMatcher(glob);
    } else {
      return new PatternMatcher(GlobPattern.globToRegexPattern(glob));
    }
  }

  public static boolean matches(Matcher matcher, String str) {
    return (matcher == null) || matcher.matches(str);
  }

  static boolean isAny(String glob) {
    if (glob.isEmpty()) {
      return false;
    }
    for (int i = 0; i < glob.length(); ++i) {
      if (glob.charAt(i) != '*') return false;
    }
    return true;
  }

  static boolean isExact(String glob) {
    return (glob.indexOf('*') == -1) && (glob.indexOf('?') == -1);
  }

  static final class AnyMatcher implements Matcher {
    @Override
    public boolean matches(String str) {
      return true;
    }

    @Override
    public String toString() {
      return "*";
    }
  }

  static final class EqualsMatcher implements Matcher {
    private final String exact;

    EqualsMatcher(String exact) {
      this.exact = exact;
    }

    @Override
    public boolean matches(String str) {
      return exact.equals(str);
    }

    @Override
    public String toString() {
      return exact;
    }
  }

  static final class PatternMatcher implements Matcher {
    private final Pattern pattern;

    PatternMatcher(Pattern pattern) {
      this.pattern = pattern;
    }

    @Override
    public boolean matches(String str) {
      return str != null && pattern.matcher(str).matches();
    }

    @Override
    public String toString() {
      return pattern.pattern();
    }
  }
}
