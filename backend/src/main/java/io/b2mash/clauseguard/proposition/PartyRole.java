package io.b2mash.clauseguard.proposition;

import java.util.List;

/** Party roles recognized in clause text. */
public enum PartyRole {
  SELLER("seller"),
  BUYER("buyer"),
  VENDOR("vendor"),
  CUSTOMER("customer"),
  LICENSEE("licensee"),
  LICENSOR("licensor"),
  PARTY("party", "parties"),
  COMPANY("company"),
  CONTRACTOR("contractor");

  private final List<String> keywords;

  PartyRole(String... keywords) {
    this.keywords = List.of(keywords);
  }

  /** Whether lower-cased clause text mentions this role. */
  public boolean isMentionedIn(String normalizedText) {
    return keywords.stream().anyMatch(normalizedText::contains);
  }
}
