package io.rapitapir.types.format;

import io.rapitapir.types.util.TemporalParsing;

import java.net.InetAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/** Built-in string formats: email, uri, uuid, date, datetime, ipv4, ipv6. */
public final class DefaultFormatValidatorProvider implements FormatValidatorProvider {
  public static final Pattern EMAIL =
      Pattern.compile("^[\\w+\\-.]+@[a-z\\d\\-]+(\\.[a-z\\d\\-]+)*\\.[a-z]+$", Pattern.CASE_INSENSITIVE);

  /** Versioned UUID: version nibble 1-5, variant nibble 8, 9, a or b. */
  public static final Pattern UUID =
      Pattern.compile("^[0-9a-f]{8}-[0-9a-f]{4}-[1-5][0-9a-f]{3}-[89ab][0-9a-f]{3}-[0-9a-f]{12}$", Pattern.CASE_INSENSITIVE);

  static final Pattern IPV4 = Pattern.compile(
      "^(?:(?:25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)\\.){3}(?:25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)$");

  private static final Pattern IPV6_CHARS = Pattern.compile("^[0-9A-Fa-f:][0-9A-Fa-f:.]*$");

  @Override
  public Collection<FormatValidator> formatValidators() {
    return List.of(
        new PredicateFormat("email", Set.of(), EMAIL.asMatchPredicate(), "Invalid email format"),
        new PredicateFormat("uri", Set.of("url"), DefaultFormatValidatorProvider::isUri, "Invalid URI format"),
        new PredicateFormat("uuid", Set.of(), UUID.asMatchPredicate(), "Invalid UUID format"),
        new PredicateFormat("date", Set.of(), TemporalParsing::isDate, "Invalid date format"),
        new PredicateFormat("datetime", Set.of("date-time"), TemporalParsing::isDateTime, "Invalid datetime format"),
        new PredicateFormat("ipv4", Set.of(), IPV4.asMatchPredicate(), "Invalid IPv4 format"),
        new PredicateFormat("ipv6", Set.of(), DefaultFormatValidatorProvider::isIpv6, "Invalid IPv6 format")
    );
  }

  static boolean isUri(String value) {
    try {
      new URI(value);
      return true;
    } catch (URISyntaxException e) {
      return false;
    }
  }

  static boolean isIpv6(String value) {
    // A hex digit or ':' up front keeps InetAddress on the literal path (no name lookup).
    if (value.indexOf(':') < 0 || !IPV6_CHARS.matcher(value).matches()) return false;
    try {
      InetAddress.getByName(value);
      return true;
    } catch (UnknownHostException e) {
      return false;
    }
  }

  /** Format backed by a predicate with a single fixed error message. */
  static final class PredicateFormat implements FormatValidator {
    private final String name;
    private final Set<String> aliases;
    private final Predicate<String> accepts;
    private final String error;

    PredicateFormat(String name, Set<String> aliases, Predicate<String> accepts, String error) {
      this.name = name;
      this.aliases = aliases;
      this.accepts = accepts;
      this.error = error;
    }

    @Override public String name() { return name; }
    @Override public Set<String> aliases() { return aliases; }

    @Override
    public List<String> validate(String value) {
      return value != null && accepts.test(value) ? List.of() : List.of(error);
    }
  }
}
