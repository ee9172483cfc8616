package com.gentoro.knowledge.ingest;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives standard name, domain, version and family from document ids such as {@code
 * aiag-vda-fmea-2019} or {@code mil-std-882e}. The first matching pattern wins.
 */
public class StandardMetadataExtractor {

  private record NamePattern(Pattern pattern, String template) {}

  private record DomainPattern(Pattern pattern, String domain) {}

  private static final List<NamePattern> STANDARDS =
      List.of(
          name("aiag[-_]?vda[-_]?fmea[-_]?(\\d{4})", "AIAG-VDA FMEA %s"),
          name("aiag[-_]?fmea[-_]?(\\d)[-_]?(\\d{4})", "AIAG FMEA-%s %s"),
          name("mil[-_]?std[-_]?882([a-z]?)", "MIL-STD-882%s"),
          // the year must be separated, otherwise "iso-26262" reads as ISO 2:6262
          name("iso[-_]?(\\d+)[-_](\\d{4})", "ISO %s:%s"),
          name("iec[-_]?(\\d+)[-_](\\d{4})", "IEC %s:%s"),
          name("sae[-_]?j(\\d+)", "SAE J%s"),
          name("iso[-_]?26262", "ISO 26262"),
          name("iatf[-_]?16949", "IATF 16949"),
          name("as[-_]?9100", "AS9100"));

  private static final List<DomainPattern> DOMAINS =
      List.of(
          domain("(aiag|vda|fmea|sae[-_]?j1739)", "fmea"),
          domain("(mil[-_]?std[-_]?882|iec[-_]?61508|iso[-_]?26262)", "safety"),
          domain("(iso[-_]?9001|iatf[-_]?16949|as[-_]?9100)", "quality"),
          domain("(iso[-_]?31000|fmeca)", "reliability"));

  private static final Map<String, String> FAMILIES =
      Map.of(
          "fmea", "fmea_methodology",
          "safety", "safety",
          "quality", "quality",
          "reliability", "reliability");

  private static final Pattern YEAR = Pattern.compile("(19|20)\\d{2}");
  private static final Pattern REVISION = Pattern.compile("[-_](\\d+)([a-zA-Z])(?:[-_]|$)");

  public StandardMetadata extract(String documentId) {
    if (documentId == null || documentId.isBlank()) return StandardMetadata.NONE;
    String domain = domain(documentId);
    return new StandardMetadata(
        standardName(documentId),
        domain,
        version(documentId),
        domain == null ? null : FAMILIES.get(domain));
  }

  String standardName(String documentId) {
    for (NamePattern p : STANDARDS) {
      Matcher m = p.pattern().matcher(documentId);
      if (m.find()) {
        Object[] groups = new Object[m.groupCount()];
        for (int i = 0; i < groups.length; i++) {
          String g = m.group(i + 1);
          groups[i] = g == null ? "" : g.toUpperCase(Locale.ROOT);
        }
        return p.template().formatted(groups).trim();
      }
    }
    return null;
  }

  String domain(String documentId) {
    for (DomainPattern p : DOMAINS) {
      if (p.pattern().matcher(documentId).find()) return p.domain();
    }
    return null;
  }

  String version(String documentId) {
    Matcher year = YEAR.matcher(documentId);
    if (year.find()) return year.group();
    Matcher revision = REVISION.matcher(documentId);
    if (revision.find()) return revision.group(2).toUpperCase(Locale.ROOT);
    return null;
  }

  private static NamePattern name(String regex, String template) {
    return new NamePattern(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), template);
  }

  private static DomainPattern domain(String regex, String domain) {
    return new DomainPattern(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), domain);
  }
}
