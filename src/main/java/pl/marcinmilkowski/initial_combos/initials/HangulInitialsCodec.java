package pl.marcinmilkowski.initial_combos.initials;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Initials codec for Korean words.
 *
 * Words are NFC-normalized first, so decomposed jamo sequences coming from
 * dictionary dumps compose back into syllable blocks. Whitespace inside a
 * word is ignored; anything other than a precomposed Hangul syllable
 * (U+AC00..U+D7A3) is rejected.
 *
 * <ul>
 *   <li>{@link UnitKind#SYLLABLE}: 결근 -> [결, 근]</li>
 *   <li>{@link UnitKind#CHOSEONG}: 결근 -> [ㄱ, ㄱ] (compatibility jamo)</li>
 * </ul>
 */
public final class HangulInitialsCodec implements InitialsCodec {

    private static final int SYLLABLE_FIRST = 0xAC00;
    private static final int SYLLABLE_LAST = 0xD7A3;
    // 21 medial vowels x 28 finals per leading consonant
    private static final int SYLLABLES_PER_CHOSEONG = 21 * 28;

    private static final char[] CHOSEONG = {
        'ㄱ', 'ㄲ', 'ㄴ', 'ㄷ', 'ㄸ', 'ㄹ', 'ㅁ', 'ㅂ', 'ㅃ', 'ㅅ',
        'ㅆ', 'ㅇ', 'ㅈ', 'ㅉ', 'ㅊ', 'ㅋ', 'ㅌ', 'ㅍ', 'ㅎ'
    };

    private final UnitKind unitKind;

    public HangulInitialsCodec() {
        this(UnitKind.SYLLABLE);
    }

    public HangulInitialsCodec(UnitKind unitKind) {
        this.unitKind = Objects.requireNonNull(unitKind, "unitKind");
    }

    @Override
    public UnitKind unitKind() {
        return unitKind;
    }

    @Override
    public List<String> initialsOf(String word) {
        if (word == null) {
            throw new UnsupportedCharacterException("Word must not be null");
        }
        String normalized = Normalizer.normalize(word, Normalizer.Form.NFC);
        List<String> units = new ArrayList<>(normalized.length());
        for (int i = 0; i < normalized.length(); ) {
            int cp = normalized.codePointAt(i);
            if (Character.isWhitespace(cp)) {
                i += Character.charCount(cp);
                continue;
            }
            if (!isSyllable(cp)) {
                throw new UnsupportedCharacterException(normalized, i);
            }
            units.add(unitOf(cp));
            i += Character.charCount(cp);
        }
        if (units.isEmpty()) {
            throw new UnsupportedCharacterException("Word has no Hangul syllables: \"" + word + "\"");
        }
        return Collections.unmodifiableList(units);
    }

    @Override
    public String normalizeUnit(String unit) {
        if (unit == null) {
            throw new UnsupportedCharacterException("Initial-unit must not be null");
        }
        String normalized = Normalizer.normalize(unit.trim(), Normalizer.Form.NFC);
        if (normalized.isEmpty() || normalized.codePointCount(0, normalized.length()) != 1) {
            throw new UnsupportedCharacterException("Initial-unit must be a single character: \"" + unit + "\"");
        }
        int cp = normalized.codePointAt(0);
        if (isSyllable(cp)) {
            return unitOf(cp);
        }
        if (unitKind == UnitKind.CHOSEONG && isChoseongJamo(cp)) {
            return normalized;
        }
        throw new UnsupportedCharacterException(normalized, 0);
    }

    private String unitOf(int syllable) {
        if (unitKind == UnitKind.SYLLABLE) {
            return new String(Character.toChars(syllable));
        }
        return String.valueOf(CHOSEONG[(syllable - SYLLABLE_FIRST) / SYLLABLES_PER_CHOSEONG]);
    }

    static boolean isSyllable(int cp) {
        return cp >= SYLLABLE_FIRST && cp <= SYLLABLE_LAST;
    }

    private static boolean isChoseongJamo(int cp) {
        for (char c : CHOSEONG) {
            if (c == cp) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "HangulInitialsCodec[" + unitKind + "]";
    }
}
