/*
 * どこで: Hunt サービス層
 * 何を: キーワードとディレクトリの既知タグで依頼を分類するローカル実装
 * なぜ: LLM 連携なしでも Hunt の経路を一通り動かせるようにするため
 */
package com.atlassupport.hunt.service;

import com.atlassupport.hunt.model.Classification;
import com.atlassupport.hunt.model.Expert;
import com.atlassupport.hunt.model.RequestCategory;
import com.atlassupport.hunt.repository.ExpertDirectory;
import com.atlassupport.hunt.repository.StoreUnavailableException;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "hunt.classifier",
    havingValue = "keyword",
    matchIfMissing = true)
public class KeywordUrgencyClassifier implements UrgencyClassifier {

  private static final int BASE_URGENCY = 20;

  // 語ごとの加点。合計は 100 で頭打ち
  private static final Map<String, Integer> URGENCY_WEIGHTS =
      Map.of(
          "urgent", 40,
          "asap", 30,
          "emergency", 50,
          "outage", 50,
          "down", 30,
          "critical", 40,
          "blocked", 25,
          "production", 20,
          "broken", 20);

  private static final Map<RequestCategory, String> DRAFT_REPLIES =
      Map.of(
          RequestCategory.URGENT_ISSUE,
          "This looks urgent. I'm getting the right person on it right away.",
          RequestCategory.TECHNICAL_ISSUE,
          "Thanks for the details. I'm checking who on the team knows this system best.",
          RequestCategory.ACCESS_REQUEST,
          "Got it, this looks like an access request. I'll route it to someone who can grant it.",
          RequestCategory.GENERAL_QUESTION,
          "Good question. Let me see who can give you an accurate answer.");

  private static final int URGENT_THRESHOLD = 80;

  private final ExpertDirectory directory;

  @Override
  public Classification classify(String rawText, String requesterId) {
    final String text = rawText.toLowerCase(Locale.ROOT);
    final Set<String> tags = matchKnownTags(text);
    final int urgency = scoreUrgency(text);
    final RequestCategory category = categorize(text, tags, urgency);
    return new Classification(urgency, tags, category, DRAFT_REPLIES.get(category));
  }

  private Set<String> matchKnownTags(String text) {
    final Set<String> known = new LinkedHashSet<>();
    try {
      for (Expert expert : directory.listExperts()) {
        known.addAll(expert.expertiseTags());
      }
    } catch (StoreUnavailableException ex) {
      throw new ClassificationUnavailableException("expertise areas unavailable", ex);
    }
    final Set<String> matched = new LinkedHashSet<>();
    for (String tag : known) {
      if (containsWord(text, tag)) {
        matched.add(tag);
      }
    }
    return matched;
  }

  private int scoreUrgency(String text) {
    int score = BASE_URGENCY;
    for (Map.Entry<String, Integer> entry : URGENCY_WEIGHTS.entrySet()) {
      if (containsWord(text, entry.getKey())) {
        score += entry.getValue();
      }
    }
    return Math.min(Classification.MAX_URGENCY, score);
  }

  private RequestCategory categorize(String text, Set<String> tags, int urgency) {
    if (urgency >= URGENT_THRESHOLD) {
      return RequestCategory.URGENT_ISSUE;
    }
    if (containsWord(text, "access") || containsWord(text, "permission")) {
      return RequestCategory.ACCESS_REQUEST;
    }
    if (!tags.isEmpty() || containsWord(text, "error")) {
      return RequestCategory.TECHNICAL_ISSUE;
    }
    if (text.contains("?")) {
      return RequestCategory.GENERAL_QUESTION;
    }
    return RequestCategory.OTHER;
  }

  private boolean containsWord(String text, String word) {
    return Pattern.compile("(^|\\W)" + Pattern.quote(word) + "($|\\W)").matcher(text).find();
  }
}
