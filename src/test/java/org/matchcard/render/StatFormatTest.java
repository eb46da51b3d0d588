package org.matchcard.render;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

public class StatFormatTest {

    @Test
    public void testCompactThousands() {
        assertEquals("15.4k", StatFormat.compact(15432));
        assertEquals("1.0k", StatFormat.compact(1000));
        assertEquals("28.1k", StatFormat.compact(28113));
    }

    @Test
    public void testCompactBelowThousandIsPlain() {
        assertEquals("850", StatFormat.compact(850));
        assertEquals("999", StatFormat.compact(999));
        assertEquals("0", StatFormat.compact(0));
    }

    @Test
    public void testPlayerNameTruncation() {
        assertEquals("TwelveChars!", StatFormat.playerName("TwelveChars!"));
        assertEquals("Thirteen C..", StatFormat.playerName("Thirteen Char"));
        assertEquals("Hide on bu..", StatFormat.playerName("Hide on bush forever"));
        assertEquals("", StatFormat.playerName(null));
    }

    @Test
    public void testTruncationKeepsSurrogatePairsWhole() {
        String name = "Smurf\uD83D\uDC09\uD83D\uDC09\uD83D\uDC09\uD83D\uDC09";
        String shown = StatFormat.playerName(name);

        assertEquals("Smurf\uD83D\uDC09\uD83D\uDC09..", shown);
        assertFalse(Character.isHighSurrogate(shown.charAt(shown.length() - 3)));
    }

    @Test
    public void testKda() {
        assertEquals("9 / 2 / 7", StatFormat.kda(9, 2, 7));
        assertEquals("0 / 0 / 0", StatFormat.kda(0, 0, 0));
    }

    @Test
    public void testGameInfoPadsSeconds() {
        assertEquals("CLASSIC • 31:05", StatFormat.gameInfo("CLASSIC", 1865));
        assertEquals("ARAM • 0:00", StatFormat.gameInfo("ARAM", 0));
        assertEquals("CLASSIC • 45:59", StatFormat.gameInfo("CLASSIC", 2759));
    }
}
