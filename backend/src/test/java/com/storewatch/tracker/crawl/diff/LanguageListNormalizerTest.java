package com.storewatch.tracker.crawl.diff;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LanguageListNormalizerTest {

    @Test
    void separatorsCaseAndOrderDoNotMatter() {
        assertThat(LanguageListNormalizer.normalize("English, Japanese<br>"))
            .isEqualTo(LanguageListNormalizer.normalize("japanese ,english"))
            .containsExactly("english", "japanese");
    }

    @Test
    void stripsAudioMarkersAndFootnote() {
        String markup = "English<strong>*</strong>, French, Simplified Chinese"
            + "<br><strong>*</strong>languages with full audio support";

        assertThat(LanguageListNormalizer.normalize(markup)).containsExactly("english", "french", "schinese");
    }

    @Test
    void appliesAliases() {
        assertThat(LanguageListNormalizer.normalize("Japanes; Spanish - Latin America / Portuguese - Brazil"))
            .containsExactly("brazilian", "japanese", "latam_spanish");
    }

    @Test
    void blankInputIsEmpty() {
        assertThat(LanguageListNormalizer.normalize(null)).isEmpty();
        assertThat(LanguageListNormalizer.normalize("  ")).isEmpty();
    }
}
