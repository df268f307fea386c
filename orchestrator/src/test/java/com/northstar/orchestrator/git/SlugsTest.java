package com.northstar.orchestrator.git;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SlugsTest {

    @Test
    void slugify_plainInstruction() {
        assertThat(Slugs.slugify("increase button contrast")).isEqualTo("increase-button-contrast");
    }

    @Test
    void slugify_punctuationAndAccents() {
        assertThat(Slugs.slugify("  Réduire le *contraste* du bouton!  ")).isEqualTo("reduire-le-contraste-du-bouton");
    }

    @Test
    void slugify_longText_isCappedWithoutTrailingDash() {
        String slug = Slugs.slugify("a".repeat(49) + " bcd");
        assertThat(slug).hasSizeLessThanOrEqualTo(Slugs.MAX_LENGTH).doesNotEndWith("-");
    }

    @Test
    void slugify_nothingUsable_fallsBack() {
        assertThat(Slugs.slugify("!!!")).isEqualTo("change");
        assertThat(Slugs.slugify(null)).isEqualTo("change");
    }
}
