package br.fluitax.kardex.domain;

import br.fluitax.common.util.TextNormalizer;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Name-token matcher for one required participant of the consolidation.
 * A company matches when its name contains every token (accent/case-insensitive).
 */
@Value
public class CompanyMatcher {

    String alias;
    List<String> nameTokens;

    public boolean matches(String companyName) {
        List<String> companyTokens = TextNormalizer.tokens(companyName);
        return !nameTokens.isEmpty() && nameTokens.stream()
                .map(TextNormalizer::normalizeText)
                .allMatch(companyTokens::contains);
    }

    /**
     * Parse "JM=JM CAFE;OLG=OLG" into matchers. Entries without tokens are ignored.
     */
    public static List<CompanyMatcher> parseAll(String spec) {
        List<CompanyMatcher> matchers = new ArrayList<>();
        if (spec == null || spec.isBlank()) {
            return matchers;
        }
        for (String entry : spec.split(";")) {
            String[] parts = entry.split("=", 2);
            String alias = parts[0].trim();
            String tokenPart = parts.length > 1 ? parts[1] : parts[0];
            List<String> tokens = TextNormalizer.tokens(tokenPart);
            if (alias.isEmpty() || tokens.isEmpty()) {
                continue;
            }
            matchers.add(new CompanyMatcher(alias, tokens.stream().collect(Collectors.toUnmodifiableList())));
        }
        return matchers;
    }
}
