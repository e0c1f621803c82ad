package org.janelia.darkroom.image;

import java.awt.Color;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class HexColorTest {

    @Test
    public void parseIgnoresCase() {
        HexColor lower = HexColor.parse("#ff8000");
        HexColor upper = HexColor.parse("#FF8000");
        HexColor mixed = HexColor.parse("#fF8000");

        assertEquals(255, lower.getRed());
        assertEquals(128, lower.getGreen());
        assertEquals(0, lower.getBlue());
        assertEquals(upper, lower);
        assertEquals(upper, mixed);
        assertEquals("#FF8000", lower.toHex());
    }

    @Test
    public void allConstructorsConverge() {
        HexColor fromHex = HexColor.parse("#0A141E");

        assertEquals(fromHex, HexColor.fromRGB(10, 20, 30));
        assertEquals(fromHex, HexColor.fromColor(new Color(10, 20, 30)));
        assertEquals(new Color(10, 20, 30), fromHex.toColor());
    }

    @Test
    public void rejectMalformedColors() {
        String[] invalidColors = {null, "", "  ", "FF0000", "#FF000", "#FF00000", "#GG0000", "#F00", "red", "# FF0000"};
        for (String invalidColor : invalidColors) {
            try {
                HexColor.parse(invalidColor);
                fail("Expected " + invalidColor + " to be rejected");
            } catch (IllegalArgumentException expected) {
                // ok
            }
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectChannelOutOfRange() {
        HexColor.fromRGB(0, 256, 0);
    }
}
