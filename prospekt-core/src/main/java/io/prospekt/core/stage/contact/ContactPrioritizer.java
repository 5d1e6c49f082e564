package io.prospekt.core.stage.contact;

import io.prospekt.core.stage.Contact;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/// Ranks contacts by seniority and technical relevance of their title.
///
/// ### Scoring
/// - +10 when the title contains any of `CTO`, `VP`, `Chief`, `Director`, `Head`
///   (case-insensitive, counted once)
/// - +5 when the title mentions `technology` or `engineering`
///
/// Ties keep discovery order.
public final class ContactPrioritizer {

    private static final List<String> SENIOR_TITLES =
            List.of("cto", "vp", "chief", "director", "head");

    static final String TECH_LEADER_REASON =
            "Senior technology decision maker - high influence on tech purchases";
    static final String EXECUTIVE_REASON =
            "Executive level contact - can champion solutions internally";
    static final String DEPARTMENT_LEADER_REASON =
            "Department leader - involved in solution evaluation";
    static final String STAKEHOLDER_REASON = "Key stakeholder in decision process";

    /// Scores and sorts contacts, highest score first.
    ///
    /// @param contacts discovered contacts, not null
    /// @return new list of ranked copies, never null
    public List<Contact> prioritize(List<Contact> contacts) {
        List<Contact> ranked = new ArrayList<>(contacts.size());
        for (Contact contact : contacts) {
            ranked.add(contact.withPriority(score(contact.title()), reason(contact.title())));
        }
        ranked.sort(Comparator.comparingInt(Contact::priorityScore).reversed());
        return ranked;
    }

    int score(String title) {
        String lower = title.toLowerCase(Locale.ROOT);
        int score = 0;
        for (String senior : SENIOR_TITLES) {
            if (lower.contains(senior)) {
                score += 10;
                break;
            }
        }
        if (lower.contains("technology") || lower.contains("engineering")) {
            score += 5;
        }
        return score;
    }

    String reason(String title) {
        if (title.contains("CTO") || title.contains("Chief Technology")) {
            return TECH_LEADER_REASON;
        }
        if (title.contains("VP")) {
            return EXECUTIVE_REASON;
        }
        if (title.contains("Director")) {
            return DEPARTMENT_LEADER_REASON;
        }
        return STAKEHOLDER_REASON;
    }
}
