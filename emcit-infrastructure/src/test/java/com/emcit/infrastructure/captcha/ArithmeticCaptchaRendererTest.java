package com.emcit.infrastructure.captcha;

import org.junit.jupiter.api.Test;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ArithmeticCaptchaRendererTest {

    @Test
    void rendersPngOfFixedSize() throws Exception {
        byte[] png = new ArithmeticCaptchaRenderer(new Random(1)).renderPng("47 + 3 = ?");

        assertThat(png).startsWith((byte) 0x89, (byte) 'P', (byte) 'N', (byte) 'G');
        BufferedImage img = ImageIO.read(new ByteArrayInputStream(png));
        assertThat(img.getWidth()).isEqualTo(ArithmeticCaptchaRenderer.WIDTH);
        assertThat(img.getHeight()).isEqualTo(ArithmeticCaptchaRenderer.HEIGHT);
    }

    @Test
    void noiseDiffersBetweenRenders() {
        var renderer = new ArithmeticCaptchaRenderer();

        assertThat(renderer.renderPng("99 + 9 = ?")).isNotEqualTo(renderer.renderPng("99 + 9 = ?"));
    }

    @Test
    void rejectsCharactersItCannotDraw() {
        assertThatThrownBy(() -> new ArithmeticCaptchaRenderer(new Random(1)).renderPng("4 x 2"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
