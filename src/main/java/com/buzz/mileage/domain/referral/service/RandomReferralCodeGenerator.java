package com.buzz.mileage.domain.referral.service;

import java.util.Locale;
import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * 이름 앞 3글자 + 랜덤 6자리 (예: KIM3F9A1C)
 */
@Component
public class RandomReferralCodeGenerator implements ReferralCodeGenerator {

    private static final int PREFIX_LENGTH = 3;
    private static final int RANDOM_LENGTH = 6;
    private static final int FALLBACK_LENGTH = 8;
    private static final String DEFAULT_PREFIX = "BZ";

    @Override
    public String generate(String name) {
        return prefixOf(name) + randomChars(RANDOM_LENGTH);
    }

    @Override
    public String fallback() {
        return randomChars(FALLBACK_LENGTH);
    }

    private static String prefixOf(String name) {
        if (name == null) {
            return DEFAULT_PREFIX;
        }
        StringBuilder sb = new StringBuilder();
        name.codePoints()
                .filter(Character::isLetterOrDigit)
                .limit(PREFIX_LENGTH)
                .forEach(sb::appendCodePoint);
        return sb.length() == 0 ? DEFAULT_PREFIX : sb.toString().toUpperCase(Locale.ROOT);
    }

    private static String randomChars(int length) {
        return UUID.randomUUID().toString().replace("-", "")
                .substring(0, length)
                .toUpperCase(Locale.ROOT);
    }
}
