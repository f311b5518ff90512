package com.williamcallahan.llmorchestrator.service.cost;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.EncodingType;

/**
 * Counts prompt and output tokens with the cl100k_base encoding.
 *
 * <p>Providers tokenize differently; cl100k_base is close enough for pessimistic budget
 * estimates and is cheap to evaluate on every request.</p>
 */
public class TokenCounter {
    private final Encoding encoding;

    public TokenCounter() {
        EncodingRegistry registry = Encodings.newDefaultEncodingRegistry();
        this.encoding = registry.getEncoding(EncodingType.CL100K_BASE);
    }

    /**
     * Counts tokens in text, treating special-token markers as ordinary text.
     *
     * @param text text to count, may be null
     * @return token count, zero for null or empty text
     */
    public int countTokens(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return encoding.countTokensOrdinary(text);
    }
}
