package dev.vitae.extraction;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The vocabularies the extractors match against: skills, employers, and educational
 * institutions.
 *
 * @param skills skill terms with aliases
 * @param organizations known employers
 * @param institutions known universities and schools
 */
public record Lexicons(SkillLexicon skills, NameLexicon organizations, NameLexicon institutions) {

  public static Lexicons defaults() {
    return new Lexicons(SkillLexicon.defaults(), defaultOrganizations(), defaultInstitutions());
  }

  static NameLexicon defaultOrganizations() {
    Map<String, List<String>> names = new LinkedHashMap<>();
    names.put("Google", List.of("Google LLC", "Alphabet"));
    names.put("Microsoft", List.of("Microsoft Corporation"));
    names.put("Amazon", List.of("Amazon.com", "Amazon Web Services", "AWS"));
    names.put("Apple", List.of("Apple Inc"));
    names.put("Meta", List.of("Facebook", "Meta Platforms"));
    names.put("IBM", List.of("International Business Machines"));
    names.put("Oracle", List.of("Oracle Corporation"));
    names.put("SAP", List.of());
    names.put("Accenture", List.of());
    names.put("Deloitte", List.of());
    names.put("Infosys", List.of());
    names.put("Tata Consultancy Services", List.of("TCS"));
    names.put("Wipro", List.of());
    names.put("Cognizant", List.of());
    names.put("Capgemini", List.of());
    names.put("Goldman Sachs", List.of());
    names.put("JPMorgan Chase", List.of("JP Morgan", "J.P. Morgan"));
    names.put("Netflix", List.of());
    names.put("Salesforce", List.of());
    names.put("Adobe", List.of());
    return new NameLexicon(names, NameLexicon.DEFAULT_MIN_SIMILARITY);
  }

  static NameLexicon defaultInstitutions() {
    Map<String, List<String>> names = new LinkedHashMap<>();
    names.put("Massachusetts Institute of Technology", List.of("MIT"));
    names.put("Stanford University", List.of("Stanford"));
    names.put("Harvard University", List.of("Harvard"));
    names.put("University of Cambridge", List.of("Cambridge University"));
    names.put("University of Oxford", List.of("Oxford University"));
    names.put("Cochin University of Science and Technology", List.of("CUSAT"));
    names.put("Indian Institute of Technology Bombay", List.of("IIT Bombay"));
    names.put("Indian Institute of Technology Delhi", List.of("IIT Delhi"));
    names.put("University of California, Berkeley", List.of("UC Berkeley", "Berkeley"));
    names.put("Carnegie Mellon University", List.of("CMU"));
    names.put("ETH Zurich", List.of("ETH Zürich"));
    names.put("University of Toronto", List.of());
    return new NameLexicon(names, NameLexicon.DEFAULT_MIN_SIMILARITY);
  }
}
