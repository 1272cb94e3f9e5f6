package com.onthegomap.styleexpr.value;

import com.onthegomap.styleexpr.util.Format;
import com.onthegomap.styleexpr.util.Parse;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * A color with red, green, blue, and alpha channels normalized to {@code [0, 1]}.
 * <p>
 * Channels are stored exactly as given: no gamma correction, premultiplication, or rounding is ever applied.
 */
public record Color(double red, double green, double blue, double alpha) {

  public static final Color TRANSPARENT = new Color(0, 0, 0, 0);
  public static final Color BLACK = new Color(0, 0, 0, 1);
  public static final Color WHITE = new Color(1, 1, 1, 1);

  private static final Pattern HEX = Pattern.compile("^#([0-9a-f]{3,4}|[0-9a-f]{6}|[0-9a-f]{8})$");
  private static final Pattern FUNCTION = Pattern.compile("^(rgba?|hsla?)\\(([^)]*)\\)$");
  private static final Pattern ARG_SEPARATOR = Pattern.compile("\\s*[,/\\s]\\s*");

  public Color {
    checkChannel("red", red);
    checkChannel("green", green);
    checkChannel("blue", blue);
    checkChannel("alpha", alpha);
  }

  private static void checkChannel(String name, double value) {
    if (!(value >= 0 && value <= 1)) {
      throw new IllegalArgumentException(name + " must be between 0 and 1, got " + value);
    }
  }

  /** Returns a color from 0-255 red, green, and blue channels and a 0-1 alpha channel. */
  public static Color rgba(double red, double green, double blue, double alpha) {
    return new Color(red / 255d, green / 255d, blue / 255d, alpha);
  }

  public static Color rgb(double red, double green, double blue) {
    return rgba(red, green, blue, 1);
  }

  /**
   * Returns the color described by a CSS color string like {@code "red"}, {@code "#ff0000"},
   * {@code "rgba(255, 0, 0, 0.5)"} or {@code "hsl(0, 100%, 50%)"}, or null if {@code css} is not a color.
   */
  public static Color parse(String css) {
    if (css == null) {
      return null;
    }
    String input = css.strip().toLowerCase(Locale.ROOT);
    Integer named = NAMED.get(input);
    if (named != null) {
      return fromHex(named, 0xff);
    } else if ("transparent".equals(input)) {
      return TRANSPARENT;
    }
    var hexMatcher = HEX.matcher(input);
    if (hexMatcher.matches()) {
      return parseHex(hexMatcher.group(1));
    }
    var functionMatcher = FUNCTION.matcher(input);
    if (functionMatcher.matches()) {
      String[] args = ARG_SEPARATOR.split(functionMatcher.group(2).strip());
      return functionMatcher.group(1).startsWith("rgb") ? parseRgb(args) : parseHsl(args);
    }
    return null;
  }

  private static Color parseHex(String hex) {
    if (hex.length() <= 4) {
      StringBuilder expanded = new StringBuilder();
      for (char c : hex.toCharArray()) {
        expanded.append(c).append(c);
      }
      hex = expanded.toString();
    }
    int rgb = Integer.parseInt(hex.substring(0, 6), 16);
    int alpha = hex.length() == 8 ? Integer.parseInt(hex.substring(6, 8), 16) : 0xff;
    return fromHex(rgb, alpha);
  }

  private static Color fromHex(int rgb, int alpha) {
    return new Color(
      ((rgb >> 16) & 0xff) / 255d,
      ((rgb >> 8) & 0xff) / 255d,
      (rgb & 0xff) / 255d,
      alpha / 255d
    );
  }

  private static Color parseRgb(String[] args) {
    if (args.length != 3 && args.length != 4) {
      return null;
    }
    double[] channels = new double[3];
    for (int i = 0; i < 3; i++) {
      Double percent = Parse.parsePercentOrNull(args[i]);
      Double value = percent != null ? Double.valueOf(percent * 255) : Parse.parseDoubleOrNull(args[i]);
      if (value == null) {
        return null;
      }
      channels[i] = clamp(value, 0, 255);
    }
    Double alpha = parseAlpha(args);
    return alpha == null ? null : rgba(channels[0], channels[1], channels[2], alpha);
  }

  private static Color parseHsl(String[] args) {
    if (args.length != 3 && args.length != 4) {
      return null;
    }
    Double hue = Parse.parseDoubleOrNull(args[0].replaceFirst("deg$", ""));
    Double saturation = Parse.parsePercentOrNull(args[1]);
    Double lightness = Parse.parsePercentOrNull(args[2]);
    Double alpha = parseAlpha(args);
    if (hue == null || saturation == null || lightness == null || alpha == null) {
      return null;
    }
    double h = (((hue % 360) + 360) % 360) / 360d;
    double s = clamp(saturation, 0, 1);
    double l = clamp(lightness, 0, 1);
    double m2 = l <= 0.5 ? l * (s + 1) : l + s - l * s;
    double m1 = l * 2 - m2;
    return new Color(
      clamp(hueToChannel(m1, m2, h + 1 / 3d), 0, 1),
      clamp(hueToChannel(m1, m2, h), 0, 1),
      clamp(hueToChannel(m1, m2, h - 1 / 3d), 0, 1),
      alpha
    );
  }

  private static double hueToChannel(double m1, double m2, double h) {
    if (h < 0) {
      h += 1;
    } else if (h > 1) {
      h -= 1;
    }
    if (h * 6 < 1) {
      return m1 + (m2 - m1) * h * 6;
    } else if (h * 2 < 1) {
      return m2;
    } else if (h * 3 < 2) {
      return m1 + (m2 - m1) * (2 / 3d - h) * 6;
    }
    return m1;
  }

  private static Double parseAlpha(String[] args) {
    if (args.length < 4) {
      return 1d;
    }
    Double percent = Parse.parsePercentOrNull(args[3]);
    Double alpha = percent != null ? percent : Parse.parseDoubleOrNull(args[3]);
    return alpha == null ? null : clamp(alpha, 0, 1);
  }

  private static double clamp(double value, double min, double max) {
    return Math.max(min, Math.min(max, value));
  }

  /** Returns the color {@code t} of the way from this color to {@code other}, channel by channel. */
  public Color blend(Color other, double t) {
    return new Color(
      clamp(red + t * (other.red - red), 0, 1),
      clamp(green + t * (other.green - green), 0, 1),
      clamp(blue + t * (other.blue - blue), 0, 1),
      clamp(alpha + t * (other.alpha - alpha), 0, 1)
    );
  }

  /** Returns {@code [red, green, blue, alpha]} with 0-255 color channels and a 0-1 alpha channel. */
  public double[] toRgbaArray() {
    return new double[]{red * 255, green * 255, blue * 255, alpha};
  }

  @Override
  public String toString() {
    return "rgba(" +
      Format.formatNumber(red * 255) + ", " +
      Format.formatNumber(green * 255) + ", " +
      Format.formatNumber(blue * 255) + ", " +
      Format.formatNumber(alpha) + ")";
  }

  // https://www.w3.org/TR/css-color-4/#named-colors
  private static final Map<String, Integer> NAMED = Map.ofEntries(
    Map.entry("aliceblue", 0xf0f8ff),
    Map.entry("antiquewhite", 0xfaebd7),
    Map.entry("aqua", 0x00ffff),
    Map.entry("aquamarine", 0x7fffd4),
    Map.entry("azure", 0xf0ffff),
    Map.entry("beige", 0xf5f5dc),
    Map.entry("bisque", 0xffe4c4),
    Map.entry("black", 0x000000),
    Map.entry("blanchedalmond", 0xffebcd),
    Map.entry("blue", 0x0000ff),
    Map.entry("blueviolet", 0x8a2be2),
    Map.entry("brown", 0xa52a2a),
    Map.entry("burlywood", 0xdeb887),
    Map.entry("cadetblue", 0x5f9ea0),
    Map.entry("chartreuse", 0x7fff00),
    Map.entry("chocolate", 0xd2691e),
    Map.entry("coral", 0xff7f50),
    Map.entry("cornflowerblue", 0x6495ed),
    Map.entry("cornsilk", 0xfff8dc),
    Map.entry("crimson", 0xdc143c),
    Map.entry("cyan", 0x00ffff),
    Map.entry("darkblue", 0x00008b),
    Map.entry("darkcyan", 0x008b8b),
    Map.entry("darkgoldenrod", 0xb8860b),
    Map.entry("darkgray", 0xa9a9a9),
    Map.entry("darkgreen", 0x006400),
    Map.entry("darkgrey", 0xa9a9a9),
    Map.entry("darkkhaki", 0xbdb76b),
    Map.entry("darkmagenta", 0x8b008b),
    Map.entry("darkolivegreen", 0x556b2f),
    Map.entry("darkorange", 0xff8c00),
    Map.entry("darkorchid", 0x9932cc),
    Map.entry("darkred", 0x8b0000),
    Map.entry("darksalmon", 0xe9967a),
    Map.entry("darkseagreen", 0x8fbc8f),
    Map.entry("darkslateblue", 0x483d8b),
    Map.entry("darkslategray", 0x2f4f4f),
    Map.entry("darkslategrey", 0x2f4f4f),
    Map.entry("darkturquoise", 0x00ced1),
    Map.entry("darkviolet", 0x9400d3),
    Map.entry("deeppink", 0xff1493),
    Map.entry("deepskyblue", 0x00bfff),
    Map.entry("dimgray", 0x696969),
    Map.entry("dimgrey", 0x696969),
    Map.entry("dodgerblue", 0x1e90ff),
    Map.entry("firebrick", 0xb22222),
    Map.entry("floralwhite", 0xfffaf0),
    Map.entry("forestgreen", 0x228b22),
    Map.entry("fuchsia", 0xff00ff),
    Map.entry("gainsboro", 0xdcdcdc),
    Map.entry("ghostwhite", 0xf8f8ff),
    Map.entry("gold", 0xffd700),
    Map.entry("goldenrod", 0xdaa520),
    Map.entry("gray", 0x808080),
    Map.entry("green", 0x008000),
    Map.entry("greenyellow", 0xadff2f),
    Map.entry("grey", 0x808080),
    Map.entry("honeydew", 0xf0fff0),
    Map.entry("hotpink", 0xff69b4),
    Map.entry("indianred", 0xcd5c5c),
    Map.entry("indigo", 0x4b0082),
    Map.entry("ivory", 0xfffff0),
    Map.entry("khaki", 0xf0e68c),
    Map.entry("lavender", 0xe6e6fa),
    Map.entry("lavenderblush", 0xfff0f5),
    Map.entry("lawngreen", 0x7cfc00),
    Map.entry("lemonchiffon", 0xfffacd),
    Map.entry("lightblue", 0xadd8e6),
    Map.entry("lightcoral", 0xf08080),
    Map.entry("lightcyan", 0xe0ffff),
    Map.entry("lightgoldenrodyellow", 0xfafad2),
    Map.entry("lightgray", 0xd3d3d3),
    Map.entry("lightgreen", 0x90ee90),
    Map.entry("lightgrey", 0xd3d3d3),
    Map.entry("lightpink", 0xffb6c1),
    Map.entry("lightsalmon", 0xffa07a),
    Map.entry("lightseagreen", 0x20b2aa),
    Map.entry("lightskyblue", 0x87cefa),
    Map.entry("lightslategray", 0x778899),
    Map.entry("lightslategrey", 0x778899),
    Map.entry("lightsteelblue", 0xb0c4de),
    Map.entry("lightyellow", 0xffffe0),
    Map.entry("lime", 0x00ff00),
    Map.entry("limegreen", 0x32cd32),
    Map.entry("linen", 0xfaf0e6),
    Map.entry("magenta", 0xff00ff),
    Map.entry("maroon", 0x800000),
    Map.entry("mediumaquamarine", 0x66cdaa),
    Map.entry("mediumblue", 0x0000cd),
    Map.entry("mediumorchid", 0xba55d3),
    Map.entry("mediumpurple", 0x9370db),
    Map.entry("mediumseagreen", 0x3cb371),
    Map.entry("mediumslateblue", 0x7b68ee),
    Map.entry("mediumspringgreen", 0x00fa9a),
    Map.entry("mediumturquoise", 0x48d1cc),
    Map.entry("mediumvioletred", 0xc71585),
    Map.entry("midnightblue", 0x191970),
    Map.entry("mintcream", 0xf5fffa),
    Map.entry("mistyrose", 0xffe4e1),
    Map.entry("moccasin", 0xffe4b5),
    Map.entry("navajowhite", 0xffdead),
    Map.entry("navy", 0x000080),
    Map.entry("oldlace", 0xfdf5e6),
    Map.entry("olive", 0x808000),
    Map.entry("olivedrab", 0x6b8e23),
    Map.entry("orange", 0xffa500),
    Map.entry("orangered", 0xff4500),
    Map.entry("orchid", 0xda70d6),
    Map.entry("palegoldenrod", 0xeee8aa),
    Map.entry("palegreen", 0x98fb98),
    Map.entry("paleturquoise", 0xafeeee),
    Map.entry("palevioletred", 0xdb7093),
    Map.entry("papayawhip", 0xffefd5),
    Map.entry("peachpuff", 0xffdab9),
    Map.entry("peru", 0xcd853f),
    Map.entry("pink", 0xffc0cb),
    Map.entry("plum", 0xdda0dd),
    Map.entry("powderblue", 0xb0e0e6),
    Map.entry("purple", 0x800080),
    Map.entry("rebeccapurple", 0x663399),
    Map.entry("red", 0xff0000),
    Map.entry("rosybrown", 0xbc8f8f),
    Map.entry("royalblue", 0x4169e1),
    Map.entry("saddlebrown", 0x8b4513),
    Map.entry("salmon", 0xfa8072),
    Map.entry("sandybrown", 0xf4a460),
    Map.entry("seagreen", 0x2e8b57),
    Map.entry("seashell", 0xfff5ee),
    Map.entry("sienna", 0xa0522d),
    Map.entry("silver", 0xc0c0c0),
    Map.entry("skyblue", 0x87ceeb),
    Map.entry("slateblue", 0x6a5acd),
    Map.entry("slategray", 0x708090),
    Map.entry("slategrey", 0x708090),
    Map.entry("snow", 0xfffafa),
    Map.entry("springgreen", 0x00ff7f),
    Map.entry("steelblue", 0x4682b4),
    Map.entry("tan", 0xd2b48c),
    Map.entry("teal", 0x008080),
    Map.entry("thistle", 0xd8bfd8),
    Map.entry("tomato", 0xff6347),
    Map.entry("turquoise", 0x40e0d0),
    Map.entry("violet", 0xee82ee),
    Map.entry("wheat", 0xf5deb3),
    Map.entry("white", 0xffffff),
    Map.entry("whitesmoke", 0xf5f5f5),
    Map.entry("yellow", 0xffff00),
    Map.entry("yellowgreen", 0x9acd32)
  );
}
