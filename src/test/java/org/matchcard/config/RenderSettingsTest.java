package org.matchcard.config;

import org.junit.Test;
import org.matchcard.layout.RowOrder;
import org.matchcard.layout.ScoreboardGeometry;

import java.nio.file.Paths;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.junit.Assert.*;

public class RenderSettingsTest {

    @Test
    public void testDefaultsMatchStockScoreboard() {
        RenderSettings settings = new RenderSettings().validate();

        assertEquals(ScoreboardGeometry.defaults(), settings.geometry());
        assertEquals(2, settings.getRenderConcurrency());
        assertEquals(Duration.ofSeconds(30), settings.renderTimeout());
        assertEquals(RowOrder.TEAM_POSITION, settings.getRowOrder());
        assertTrue(settings.usesLatestVersion());
    }

    @Test
    public void testEnvironmentOverrides() {
        Map<String, String> env = new HashMap<>();
        env.put("MATCHCARD_DDRAGON_VERSION", "14.1.1");
        env.put("MATCHCARD_CACHE_ROOT", "/var/cache/matchcard");
        env.put("MATCHCARD_RENDER_CONCURRENCY", "4");
        env.put("MATCHCARD_ADMISSION_TIMEOUT_SECONDS", " 5 ");
        env.put("MATCHCARD_MAIN_ITEM_SLOTS", "7");
        env.put("MATCHCARD_ROW_ORDER", "kills_descending");

        RenderSettings settings = new RenderSettings().applyEnvironment(env).validate();

        assertFalse(settings.usesLatestVersion());
        assertEquals("14.1.1", settings.getDataDragonVersion());
        assertEquals(Paths.get("/var/cache/matchcard"), settings.cacheRootPath());
        assertEquals(4, settings.getRenderConcurrency());
        assertEquals(Duration.ofSeconds(5), settings.admissionTimeout());
        assertEquals(7, settings.geometry().mainItemSlots());
        assertEquals(RowOrder.KILLS_DESCENDING, settings.getRowOrder());
    }

    @Test
    public void testUnparseableOverridesKeepCurrentValues() {
        Map<String, String> env = new HashMap<>();
        env.put("MATCHCARD_RENDER_TIMEOUT_SECONDS", "soon");
        env.put("MATCHCARD_ROW_ORDER", "alphabetical");

        RenderSettings settings = new RenderSettings().applyEnvironment(env);

        assertEquals(30, settings.getRenderTimeoutSeconds());
        assertEquals(RowOrder.TEAM_POSITION, settings.getRowOrder());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsZeroConcurrency() {
        RenderSettings settings = new RenderSettings();
        settings.setRenderConcurrency(0);
        settings.validate();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsUnsupportedSlotCount() {
        RenderSettings settings = new RenderSettings();
        settings.setMainItemSlots(8);
        settings.validate();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsBlankVersion() {
        RenderSettings settings = new RenderSettings();
        settings.setDataDragonVersion(" ");
        settings.validate();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsNegativeHeaderHeight() {
        RenderSettings settings = new RenderSettings();
        settings.setHeaderHeight(-80);
        settings.validate();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsNegativeBottomPadding() {
        RenderSettings settings = new RenderSettings();
        settings.setBottomPadding(-1);
        settings.validate();
    }

    @Test
    public void testZeroSpacingIsAllowed() {
        RenderSettings settings = new RenderSettings();
        settings.setTeamSpacing(0);
        settings.setBottomPadding(0);

        assertEquals(0, settings.validate().geometry().teamSpacing());
    }
}
