package io.b2mash.clauseguard.proposition;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns free clause text into a {@link Proposition} using keyword and pattern heuristics.
 * Extraction is total: any text, including blank text, yields a proposition.
 */
@Component
public class PropositionExtractor {

  private static final Logger log = LoggerFactory.getLogger(PropositionExtractor.class);

  private static final List<String> TERMINATION_KEYWORDS =
      List.of("terminate", "termination", "cancel", "end the agreement");
  private static final List<String> PROHIBITION_MARKERS =
      List.of("may not", "cannot", "neither", "shall not");
  private static final List<String> PERMISSION_MARKERS = List.of("may ", "can ", "allowed");
  private static final List<String> EXCLUSIVITY_MARKERS = List.of("exclusive", "only");

  static final String NOTICE_ANCHOR = "notice";
  static final String MINIMUM_TERM_ANCHOR = "before";

  private static final String DAY_UNIT = "\\s*(?:calendar\\s+)?(?:business\\s+)?days?";

  private final DayCountPattern noticePattern = new DayCountPattern(NOTICE_ANCHOR);
  private final DayCountPattern minimumTermPattern = new DayCountPattern(MINIMUM_TERM_ANCHOR);

  public Proposition extract(String clauseText) {
    String text = clauseText == null ? "" : clauseText.toLowerCase(Locale.ROOT);

    var parties = EnumSet.noneOf(PartyRole.class);
    for (PartyRole role : PartyRole.values()) {
      if (role.isMentionedIn(text)) {
        parties.add(role);
      }
    }

    var proposition =
        new Proposition(
            text,
            containsAny(text, TERMINATION_KEYWORDS),
            noticePattern.find(text),
            minimumTermPattern.find(text),
            containsAny(text, EXCLUSIVITY_MARKERS),
            containsAny(text, PROHIBITION_MARKERS),
            containsAny(text, PERMISSION_MARKERS),
            parties);
    log.debug("Extracted proposition: {}", proposition);
    return proposition;
  }

  public List<Proposition> extractAll(List<String> clauseTexts) {
    return clauseTexts.stream().map(this::extract).toList();
  }

  private static boolean containsAny(String text, List<String> keywords) {
    return keywords.stream().anyMatch(text::contains);
  }

  /**
   * Day count written next to an anchor word, either as "30 days notice" or "notice 30 days". The
   * number-before-anchor form is tried first.
   */
  private static final class DayCountPattern {

    private final String anchor;
    private final Pattern numberThenAnchor;
    private final Pattern anchorThenNumber;

    DayCountPattern(String anchor) {
      this.anchor = anchor;
      this.numberThenAnchor = Pattern.compile("(\\d+)" + DAY_UNIT + "\\s*" + anchor);
      this.anchorThenNumber = Pattern.compile(anchor + "\\s*(\\d+)" + DAY_UNIT);
    }

    OptionalInt find(String text) {
      if (!text.contains(anchor)) {
        return OptionalInt.empty();
      }
      for (Pattern pattern : List.of(numberThenAnchor, anchorThenNumber)) {
        Matcher matcher = pattern.matcher(text);
        if (matcher.find()) {
          return parse(matcher.group(1));
        }
      }
      return OptionalInt.empty();
    }

    private OptionalInt parse(String digits) {
      try {
        return OptionalInt.of(Integer.parseInt(digits));
      } catch (NumberFormatException e) {
        log.debug("Ignoring out-of-range day count near '{}': {}", anchor, digits);
        return OptionalInt.empty();
      }
    }
  }
}
