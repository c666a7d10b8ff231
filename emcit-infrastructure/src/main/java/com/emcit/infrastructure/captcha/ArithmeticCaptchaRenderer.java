package com.emcit.infrastructure.captcha;

import com.emcit.application.ports.ChallengeImagePort;

import javax.imageio.ImageIO;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.security.SecureRandom;
import java.util.Map;
import java.util.Random;

/**
 * Draws arithmetic prompts as segment glyphs over line and dot noise.
 *
 * Glyphs are filled rectangles, so rendering needs no installed fonts (headless containers).
 */
public final class ArithmeticCaptchaRenderer implements ChallengeImagePort {

    public static final int WIDTH = 280;
    public static final int HEIGHT = 90;

    private static final int GLYPH_W = 22;
    private static final int GLYPH_H = 40;
    private static final int STROKE = 5;
    private static final int GAP = 8;
    private static final int SPACE_W = 10;

    // Segments: a=top, b=upper right, c=lower right, d=bottom, e=lower left, f=upper left, g=middle
    private static final Map<Character, String> SEGMENTS = Map.ofEntries(
            Map.entry('0', "abcdef"),
            Map.entry('1', "bc"),
            Map.entry('2', "abged"),
            Map.entry('3', "abgcd"),
            Map.entry('4', "fgbc"),
            Map.entry('5', "afgcd"),
            Map.entry('6', "afgedc"),
            Map.entry('7', "abc"),
            Map.entry('8', "abcdefg"),
            Map.entry('9', "abcdfg"),
            Map.entry('?', "abg")
    );

    private final Random random;

    public ArithmeticCaptchaRenderer() {
        this(new SecureRandom());
    }

    public ArithmeticCaptchaRenderer(Random random) {
        this.random = random;
    }

    @Override
    public byte[] renderPng(String prompt) {
        BufferedImage img = new BufferedImage(WIDTH, HEIGHT, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = img.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.setColor(new Color(245, 245, 240));
            g.fillRect(0, 0, WIDTH, HEIGHT);

            drawNoise(g, 60);

            int x = 16;
            int baseY = (HEIGHT - GLYPH_H) / 2;
            for (char ch : prompt.toCharArray()) {
                if (ch == ' ') {
                    x += SPACE_W;
                    continue;
                }
                int y = baseY + random.nextInt(11) - 5;
                g.setColor(new Color(20 + random.nextInt(80), 20 + random.nextInt(80), 60 + random.nextInt(120)));
                drawGlyph(g, ch, x, y);
                x += GLYPH_W + GAP;
            }

            g.setStroke(new BasicStroke(2f));
            for (int i = 0; i < 4; i++) {
                g.setColor(new Color(random.nextInt(160), random.nextInt(160), random.nextInt(160)));
                g.drawLine(random.nextInt(WIDTH), random.nextInt(HEIGHT), random.nextInt(WIDTH), random.nextInt(HEIGHT));
            }
        } finally {
            g.dispose();
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            ImageIO.write(img, "png", out);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to encode captcha image", e);
        }
        return out.toByteArray();
    }

    private void drawNoise(Graphics2D g, int dots) {
        for (int i = 0; i < dots; i++) {
            g.setColor(new Color(150 + random.nextInt(100), 150 + random.nextInt(100), 150 + random.nextInt(100)));
            g.fillOval(random.nextInt(WIDTH), random.nextInt(HEIGHT), 3, 3);
        }
    }

    private static void drawGlyph(Graphics2D g, char ch, int x, int y) {
        switch (ch) {
            case '+' -> {
                g.fillRect(x, y + GLYPH_H / 2 - STROKE / 2, GLYPH_W, STROKE);
                g.fillRect(x + GLYPH_W / 2 - STROKE / 2, y + GLYPH_H / 2 - GLYPH_W / 2, STROKE, GLYPH_W);
            }
            case '=' -> {
                g.fillRect(x, y + GLYPH_H / 2 - STROKE * 2, GLYPH_W, STROKE);
                g.fillRect(x, y + GLYPH_H / 2 + STROKE, GLYPH_W, STROKE);
            }
            default -> {
                String segs = SEGMENTS.get(ch);
                if (segs == null) {
                    throw new IllegalArgumentException("Unsupported captcha character: " + ch);
                }
                for (char s : segs.toCharArray()) {
                    drawSegment(g, s, x, y);
                }
                if (ch == '?') {
                    g.fillRect(x + GLYPH_W / 2 - STROKE / 2, y + GLYPH_H / 2, STROKE, GLYPH_H / 4);
                    g.fillRect(x + GLYPH_W / 2 - STROKE / 2, y + GLYPH_H - STROKE, STROKE, STROKE);
                }
            }
        }
    }

    private static void drawSegment(Graphics2D g, char seg, int x, int y) {
        int half = GLYPH_H / 2;
        switch (seg) {
            case 'a' -> g.fillRect(x, y, GLYPH_W, STROKE);
            case 'b' -> g.fillRect(x + GLYPH_W - STROKE, y, STROKE, half);
            case 'c' -> g.fillRect(x + GLYPH_W - STROKE, y + half, STROKE, half);
            case 'd' -> g.fillRect(x, y + GLYPH_H - STROKE, GLYPH_W, STROKE);
            case 'e' -> g.fillRect(x, y + half, STROKE, half);
            case 'f' -> g.fillRect(x, y, STROKE, half);
            case 'g' -> g.fillRect(x, y + half - STROKE / 2, GLYPH_W, STROKE);
            default -> throw new IllegalArgumentException("Unknown segment " + seg);
        }
    }
}
