package dev.vitae.extraction;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Known skill terms with their aliases.
 *
 * <p>Lookups are case-insensitive and ignore spacing and accents. Terms flagged as ambiguous
 * (single letters, common English words such as "Go") are only recognized when they form a whole
 * list item, never when they merely occur in running text.
 */
public final class SkillLexicon {

  private static final Map<String, List<String>> DEFAULT_TERMS = defaultTerms();
  private static final Set<String> AMBIGUOUS = Set.of("C", "R", "Go", "Swift", "Rust", "Spark");

  private final Map<String, String> canonicalByAlias;
  private final Set<String> canonicalTerms;
  private final List<MentionPattern> mentionPatterns;

  public SkillLexicon(Map<String, List<String>> termsWithAliases) {
    Map<String, String> aliases = new LinkedHashMap<>();
    Set<String> terms = new LinkedHashSet<>();
    List<MentionPattern> patterns = new ArrayList<>();
    termsWithAliases.forEach(
        (term, termAliases) -> {
          terms.add(term);
          aliases.put(key(term), term);
          termAliases.forEach(alias -> aliases.put(key(alias), term));
          if (!AMBIGUOUS.contains(term)) {
            patterns.add(new MentionPattern(term, mentionPattern(term)));
            for (String alias : termAliases) {
              patterns.add(new MentionPattern(term, mentionPattern(alias)));
            }
          }
        });
    this.canonicalByAlias = Map.copyOf(aliases);
    this.canonicalTerms = Collections.unmodifiableSet(terms);
    this.mentionPatterns = List.copyOf(patterns);
  }

  /** The built-in lexicon. */
  public static SkillLexicon defaults() {
    return new SkillLexicon(DEFAULT_TERMS);
  }

  /** The built-in lexicon plus additional terms, each its own alias. */
  public static SkillLexicon withAdditionalTerms(Collection<String> additionalTerms) {
    Map<String, List<String>> terms = new LinkedHashMap<>(DEFAULT_TERMS);
    for (String term : additionalTerms) {
      if (term != null && !term.isBlank()) {
        terms.putIfAbsent(term.strip(), List.of());
      }
    }
    return new SkillLexicon(terms);
  }

  /**
   * Canonical spelling of a skill if it is known.
   *
   * @param term a skill as written, e.g. {@code "springboot"}
   * @return the canonical term, e.g. {@code "Spring Boot"}
   */
  public Optional<String> canonicalize(String term) {
    return Optional.ofNullable(canonicalByAlias.get(key(term)));
  }

  public Set<String> terms() {
    return canonicalTerms;
  }

  /**
   * Finds the known skills mentioned in running text, in order of first appearance.
   *
   * @param text free text such as an experience bullet
   * @return canonical terms, without duplicates
   */
  public List<String> findMentions(String text) {
    String folded = FieldNormalizer.deaccent(text);
    Map<Integer, String> byPosition = new TreeMap<>();
    for (MentionPattern mention : mentionPatterns) {
      Matcher matcher = mention.pattern().matcher(folded);
      if (matcher.find()) {
        byPosition.putIfAbsent(matcher.start(), mention.term());
      }
    }
    return byPosition.values().stream().distinct().toList();
  }

  static String key(String term) {
    return FieldNormalizer.deaccent(term).toLowerCase(Locale.ROOT).replaceAll("[\\s_]+", "");
  }

  private static Pattern mentionPattern(String alias) {
    return Pattern.compile(
        "(?<![\\p{L}\\p{Nd}+#.])" + Pattern.quote(alias) + "(?![\\p{L}\\p{Nd}+#])",
        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
  }

  private record MentionPattern(String term, Pattern pattern) {}

  private static Map<String, List<String>> defaultTerms() {
    Map<String, List<String>> terms = new LinkedHashMap<>();
    terms.put("Java", List.of("j2ee", "jdk", "core java"));
    terms.put("Kotlin", List.of());
    terms.put("Scala", List.of());
    terms.put("Python", List.of("python3"));
    terms.put("JavaScript", List.of("js", "ecmascript", "es6"));
    terms.put("TypeScript", List.of("ts"));
    terms.put("C", List.of());
    terms.put("C++", List.of("cpp"));
    terms.put("C#", List.of("csharp", "c sharp"));
    terms.put("Go", List.of("golang"));
    terms.put("Rust", List.of());
    terms.put("Ruby", List.of());
    terms.put("PHP", List.of());
    terms.put("Swift", List.of());
    terms.put("R", List.of());
    terms.put("SQL", List.of());
    terms.put("Spring Boot", List.of("springboot", "spring-boot"));
    terms.put("Spring", List.of("spring framework"));
    terms.put("Spring Cloud", List.of("springcloud"));
    terms.put("Hibernate", List.of("jpa"));
    terms.put("Node.js", List.of("nodejs", "node"));
    terms.put("React", List.of("reactjs", "react.js"));
    terms.put("Angular", List.of("angularjs"));
    terms.put("Vue.js", List.of("vue", "vuejs"));
    terms.put("Django", List.of());
    terms.put("Flask", List.of());
    terms.put("FastAPI", List.of());
    terms.put("MySQL", List.of("mariadb"));
    terms.put("PostgreSQL", List.of("postgres", "postgresql"));
    terms.put("MongoDB", List.of("mongo"));
    terms.put("Redis", List.of());
    terms.put("Elasticsearch", List.of("elastic search"));
    terms.put("Kafka", List.of("apache kafka"));
    terms.put("RabbitMQ", List.of());
    terms.put("Spark", List.of("apache spark", "pyspark"));
    terms.put("Hadoop", List.of());
    terms.put("Docker", List.of());
    terms.put("Kubernetes", List.of("k8s"));
    terms.put("Terraform", List.of());
    terms.put("AWS", List.of("amazon web services"));
    terms.put("Azure", List.of("microsoft azure"));
    terms.put("GCP", List.of("google cloud", "google cloud platform"));
    terms.put("Linux", List.of());
    terms.put("Git", List.of("github", "gitlab"));
    terms.put("Jenkins", List.of());
    terms.put("CI/CD", List.of("ci cd", "continuous integration"));
    terms.put("REST", List.of("rest api", "restful"));
    terms.put("GraphQL", List.of());
    terms.put("Microservices", List.of("microservice"));
    terms.put("Machine Learning", List.of("ml"));
    terms.put("Deep Learning", List.of());
    terms.put("NLP", List.of("natural language processing"));
    terms.put("TensorFlow", List.of());
    terms.put("PyTorch", List.of());
    terms.put("scikit-learn", List.of("sklearn", "scikit learn"));
    terms.put("Pandas", List.of());
    terms.put("NumPy", List.of());
    terms.put("HTML", List.of("html5"));
    terms.put("CSS", List.of("css3"));
    terms.put("Agile", List.of("scrum"));
    terms.put("Project Management", List.of());
    terms.put("Communication", List.of("communication skills"));
    terms.put("Leadership", List.of());
    return terms;
  }
}
