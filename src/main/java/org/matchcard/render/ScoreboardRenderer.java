package org.matchcard.render;

import org.matchcard.cache.AssetCache;
import org.matchcard.config.RenderSettings;
import org.matchcard.layout.ItemBar;
import org.matchcard.layout.ItemCell;
import org.matchcard.layout.LayoutEngine;
import org.matchcard.layout.RowLayout;
import org.matchcard.layout.ScoreboardLayout;
import org.matchcard.layout.TeamLayout;
import org.matchcard.model.MatchData;
import org.matchcard.model.Participant;
import org.matchcard.model.PlayerAssets;
import org.matchcard.model.RiotAccount;
import org.matchcard.util.DebugLog;
import org.matchcard.util.Deadline;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Draws the post-game scoreboard with Java2D. Layout mirrors the in-client end-of-game screen:
 * header, then a VICTORY and a DEFEAT block with one row per player.
 * <p>
 * At most {@link RenderQueue#capacity()} renders compose at once; icon loading inside a render fans
 * out over a shared pool, one task per player, and joins before any drawing starts. The pool is
 * sized so that every admitted render can run its whole fan-out at the same time.
 */
public class ScoreboardRenderer implements SummaryRenderer {
    // Column x positions
    private static final int COL_CHAMP_ICON = 8;
    private static final int COL_NAME = 56;
    private static final int COL_ITEMS = 170;
    private static final int COL_KDA = 420;
    private static final int COL_CS = 510;
    private static final int COL_GOLD = 570;
    private static final int COL_DAMAGE = 655;

    // Icon sizes
    private static final int CHAMP_ICON_SIZE = 32;
    private static final int ITEM_ICON_SIZE = 24;
    private static final int ITEM_SPACING = 2;
    private static final int TRINKET_GAP = 5;
    private static final int LEVEL_BADGE_SIZE = 14;

    private static final Color BACKGROUND = new Color(10, 20, 25);
    private static final Color VICTORY_COLOR = new Color(70, 130, 180);
    private static final Color DEFEAT_COLOR = new Color(180, 70, 70);
    private static final Color SUBTITLE_COLOR = new Color(140, 140, 140);
    private static final Color COLUMN_HEADER_COLOR = new Color(100, 100, 100);
    private static final Color TRACKED_WIN_ROW = new Color(35, 55, 75);
    private static final Color TRACKED_LOSS_ROW = new Color(65, 40, 45);
    private static final Color WIN_ROW = new Color(22, 32, 42);
    private static final Color LOSS_ROW = new Color(38, 28, 33);
    private static final Color TRACKED_TEXT = new Color(255, 215, 0);
    private static final Color MUTED_TEXT = new Color(160, 160, 160);
    private static final Color GOLD_TEXT = new Color(200, 170, 90);
    private static final Color DAMAGE_TEXT = new Color(200, 100, 100);
    private static final Color LEVEL_BADGE = new Color(0, 0, 0, 204);
    private static final Color LEVEL_TEXT = new Color(200, 200, 200);
    private static final Color EMPTY_SLOT_FILL = new Color(18, 22, 28);
    private static final Color EMPTY_SLOT_BORDER = new Color(30, 35, 40);
    private static final Color MISSING_CHAMPION = new Color(30, 35, 40);
    private static final Color BROKEN_CHAMPION = new Color(50, 50, 50);
    private static final Color BROKEN_ITEM = new Color(60, 30, 30);

    private static final Font TITLE_FONT = new Font(Font.SERIF, Font.BOLD, 28);
    private static final Font SUBTITLE_FONT = new Font(Font.SANS_SERIF, Font.BOLD, 13);
    private static final Font TEAM_FONT = new Font(Font.SANS_SERIF, Font.BOLD, 13);
    private static final Font COLUMN_FONT = new Font(Font.SANS_SERIF, Font.BOLD, 10);
    private static final Font ROW_FONT = new Font(Font.SANS_SERIF, Font.BOLD, 12);
    private static final Font LEVEL_FONT = new Font(Font.SANS_SERIF, Font.BOLD, 10);

    private final AssetCache cache;
    private final LayoutEngine layoutEngine;
    private final RenderQueue queue;
    private final Duration renderTimeout;
    private final Duration admissionTimeout;
    private final ExecutorService assetExecutor;
    private final ExecutorService submitExecutor;

    public ScoreboardRenderer(AssetCache cache, RenderSettings settings) {
        this(cache,
                new LayoutEngine(settings.geometry(), settings.getRowOrder()),
                new RenderQueue(settings.getRenderConcurrency()),
                settings.renderTimeout(),
                settings.admissionTimeout(),
                settings.getAssetThreads());
    }

    public ScoreboardRenderer(AssetCache cache, LayoutEngine layoutEngine, RenderQueue queue,
                              Duration renderTimeout, Duration admissionTimeout, int assetThreadsPerRender) {
        this.cache = cache;
        this.layoutEngine = layoutEngine;
        this.queue = queue;
        this.renderTimeout = renderTimeout;
        this.admissionTimeout = admissionTimeout;
        // room for one full fan-out per admitted render
        this.assetExecutor = Executors.newFixedThreadPool(queue.capacity() * assetThreadsPerRender,
                namedThreads("asset-loader"));
        this.submitExecutor = Executors.newCachedThreadPool(namedThreads("render"));
    }

    @Override
    public byte[] renderSummary(RiotAccount account, MatchData match) throws RenderException {
        return renderSummary(account, match, renderTimeout);
    }

    @Override
    public byte[] renderSummary(RiotAccount account, MatchData match, Duration timeout) throws RenderException {
        RenderJob job = new RenderJob(account, match, Deadline.after(timeout));
        Participant me = match.findParticipant(account.puuid())
                .orElseThrow(() -> new MissingParticipantException(account.puuid(), match.matchId()));

        RenderQueue.Slot slot;
        try {
            slot = queue.acquire(job.deadline().remainingOr(admissionTimeout));
        } catch (InterruptedException e) {
            throw job.cancelled("waiting for a render slot", e);
        }
        try (slot) {
            return renderInSlot(job, me);
        }
    }

    @Override
    public Future<byte[]> submit(RiotAccount account, MatchData match) {
        return submitExecutor.submit(() -> renderSummary(account, match));
    }

    private byte[] renderInSlot(RenderJob job, Participant me) throws RenderException {
        job.checkpoint("before layout");
        MatchData match = job.match();
        ScoreboardLayout layout = layoutEngine.layout(match.participants(), job.account().puuid());
        List<RowLayout> rows = new ArrayList<>(layout.rowCount());
        layout.teams().forEach(team -> rows.addAll(team.rows()));

        List<PlayerAssets> assets = loadAssets(job, rows);
        job.checkpoint("before drawing");

        BufferedImage image = new BufferedImage(layout.width(), layout.height(), BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = image.createGraphics();
        try {
            Canvas canvas = new Canvas(g, layout.width(), layoutEngine.geometry().rowHeight());
            canvas.drawBackground(layout.height());
            canvas.drawHeader(me, match);
            int index = 0;
            for (TeamLayout team : layout.teams()) {
                job.checkpoint("while drawing");
                canvas.drawTeamHeader(team);
                canvas.drawColumnHeaders(team.columnsY());
                for (RowLayout row : team.rows()) {
                    canvas.drawPlayerRow(row, assets.get(index++), team.victory());
                }
            }
        } finally {
            g.dispose();
        }
        job.checkpoint("before encoding");

        byte[] png = encode(image);
        DebugLog.log("[ScoreboardRenderer] Rendered match " + match.matchId() + " for "
                + job.account().gameName() + " with " + rows.size() + " players (" + png.length + " bytes)");
        return png;
    }

    /**
     * Loads icons for every row in parallel and waits for all of them. A task that fails on its own
     * yields unresolved assets; a task cut off by the deadline or an interrupt fails the render.
     */
    private List<PlayerAssets> loadAssets(RenderJob job, List<RowLayout> rows) throws RenderCancelledException {
        Deadline deadline = job.deadline();
        List<Callable<PlayerAssets>> tasks = new ArrayList<>(rows.size());
        for (RowLayout row : rows) {
            tasks.add(() -> loadPlayerAssets(row, deadline));
        }

        List<Future<PlayerAssets>> futures;
        try {
            futures = assetExecutor.invokeAll(tasks, deadline.remainingNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            throw job.cancelled("while loading assets", e);
        }

        List<PlayerAssets> result = new ArrayList<>(rows.size());
        for (int i = 0; i < futures.size(); i++) {
            Future<PlayerAssets> future = futures.get(i);
            Participant participant = rows.get(i).participant();
            if (future.isCancelled()) {
                boolean expired = deadline.isExpired();
                throw new RenderCancelledException("Render " + job.id()
                        + (expired ? " deadline expired" : " cancelled") + " while loading assets", expired);
            }
            try {
                result.add(future.get());
            } catch (ExecutionException e) {
                if (e.getCause() instanceof InterruptedException) {
                    throw new RenderCancelledException("Render " + job.id() + " interrupted while loading assets",
                            deadline.isExpired(), e.getCause());
                }
                DebugLog.warn("[ScoreboardRenderer] Asset task failed for " + participant.puuid(), e.getCause());
                result.add(PlayerAssets.unresolved(participant.puuid()));
            } catch (InterruptedException e) {
                throw job.cancelled("while collecting assets", e);
            }
        }
        return result;
    }

    private PlayerAssets loadPlayerAssets(RowLayout row, Deadline deadline) throws InterruptedException {
        Participant p = row.participant();
        ItemBar items = row.items();
        try {
            Optional<Path> champion = cache.championIcon(p.championName(), deadline);
            List<Optional<Path>> mainItems = new ArrayList<>();
            for (int itemId : items.packedItemIds()) {
                mainItems.add(cache.itemIcon(itemId, deadline));
            }
            Optional<Path> trinket = cache.itemIcon(items.trinket().itemId(), deadline);
            Optional<Path> roleItem = items.roleItem().isPresent()
                    ? cache.itemIcon(items.roleItem().get().itemId(), deadline)
                    : Optional.empty();
            return new PlayerAssets(p.puuid(), champion, mainItems, trinket, roleItem);
        } catch (RuntimeException e) {
            DebugLog.warn("[ScoreboardRenderer] Could not load icons for " + p.displayName(), e);
            return PlayerAssets.unresolved(p.puuid());
        }
    }

    private static byte[] encode(BufferedImage image) throws RenderException {
        ByteArrayOutputStream out = new ByteArrayOutputStream(64 * 1024);
        try {
            if (!ImageIO.write(image, "png", out)) {
                throw new RenderException("No PNG writer available");
            }
        } catch (IOException e) {
            throw new RenderException("Failed to encode scoreboard", e);
        }
        return out.toByteArray();
    }

    public RenderQueue queue() {
        return queue;
    }

    public LayoutEngine layoutEngine() {
        return layoutEngine;
    }

    @Override
    public void close() {
        submitExecutor.shutdownNow();
        assetExecutor.shutdownNow();
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread thread = new Thread(r, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Drawing helpers bound to one render's graphics context. Decoded icons are reused within the
     * render, since the same trinket or item often appears on several rows.
     */
    private static final class Canvas {
        private final Graphics2D g;
        private final int width;
        private final int rowHeight;
        private final Map<Path, Optional<BufferedImage>> decoded = new HashMap<>();

        Canvas(Graphics2D g, int width, int rowHeight) {
            this.g = g;
            this.width = width;
            this.rowHeight = rowHeight;
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
        }

        void drawBackground(int height) {
            fill(BACKGROUND, 0, 0, width, height);
        }

        void drawHeader(Participant me, MatchData match) {
            String title = me.win() ? "VICTORY" : "DEFEAT";
            text(title, TITLE_FONT, me.win() ? VICTORY_COLOR : DEFEAT_COLOR, 16, 12);
            String info = match.info() == null ? "" : StatFormat.gameInfo(match.info().gameMode(), match.info().gameDuration());
            text(info, SUBTITLE_FONT, SUBTITLE_COLOR, 16, 48);
        }

        void drawTeamHeader(TeamLayout team) {
            Color color = team.victory() ? VICTORY_COLOR : DEFEAT_COLOR;
            int bannerHeight = team.columnsY() - team.y();
            fill(new Color(color.getRed(), color.getGreen(), color.getBlue(), 38), 0, team.y(), width, bannerHeight);
            text(team.title(), TEAM_FONT, color, 10, team.y() + 9);
        }

        void drawColumnHeaders(int y) {
            text("CHAMPION", COLUMN_FONT, COLUMN_HEADER_COLOR, COL_CHAMP_ICON, y + 5);
            text("ITEMS", COLUMN_FONT, COLUMN_HEADER_COLOR, COL_ITEMS, y + 5);
            text("KDA", COLUMN_FONT, COLUMN_HEADER_COLOR, COL_KDA, y + 5);
            text("CS", COLUMN_FONT, COLUMN_HEADER_COLOR, COL_CS, y + 5);
            text("GOLD", COLUMN_FONT, COLUMN_HEADER_COLOR, COL_GOLD, y + 5);
            text("DMG", COLUMN_FONT, COLUMN_HEADER_COLOR, COL_DAMAGE, y + 5);
        }

        void drawPlayerRow(RowLayout row, PlayerAssets assets, boolean victory) {
            Participant player = row.participant();
            int y = row.y();
            Color background = row.tracked()
                    ? (victory ? TRACKED_WIN_ROW : TRACKED_LOSS_ROW)
                    : (victory ? WIN_ROW : LOSS_ROW);
            fill(background, 0, y, width, rowHeight);

            Color textColor = row.tracked() ? TRACKED_TEXT : Color.WHITE;
            int iconY = y + (rowHeight - CHAMP_ICON_SIZE) / 2;
            icon(assets.championIcon(), COL_CHAMP_ICON, iconY, CHAMP_ICON_SIZE, MISSING_CHAMPION, BROKEN_CHAMPION);
            drawLevelBadge(player.champLevel(), COL_CHAMP_ICON, iconY + CHAMP_ICON_SIZE - 12);

            text(StatFormat.playerName(player.displayName()), ROW_FONT, textColor, COL_NAME, y + 15);
            drawItems(row.items(), assets, y + (rowHeight - ITEM_ICON_SIZE) / 2);

            text(StatFormat.kda(player.kills(), player.deaths(), player.assists()), ROW_FONT, textColor, COL_KDA, y + 15);
            text(Integer.toString(player.creepScore()), ROW_FONT, MUTED_TEXT, COL_CS, y + 15);
            text(StatFormat.compact(player.goldEarned()), ROW_FONT, GOLD_TEXT, COL_GOLD, y + 15);
            text(StatFormat.compact(player.totalDamageDealtToChampions()), ROW_FONT, DAMAGE_TEXT, COL_DAMAGE, y + 15);
        }

        private void drawLevelBadge(int level, int x, int y) {
            fill(LEVEL_BADGE, x, y, LEVEL_BADGE_SIZE, LEVEL_BADGE_SIZE);
            String label = Integer.toString(level);
            g.setFont(LEVEL_FONT);
            FontMetrics metrics = g.getFontMetrics();
            int textX = x + (LEVEL_BADGE_SIZE - metrics.stringWidth(label)) / 2;
            text(label, LEVEL_FONT, LEVEL_TEXT, textX, y + 1);
        }

        /**
         * Packed main items, padding cells, a gap, the trinket, then the role item if there is one.
         */
        private void drawItems(ItemBar items, PlayerAssets assets, int y) {
            int packed = 0;
            List<ItemCell> cells = items.mainCells();
            for (int i = 0; i < cells.size(); i++) {
                int x = COL_ITEMS + i * (ITEM_ICON_SIZE + ITEM_SPACING);
                if (cells.get(i).isEmpty()) {
                    emptySlot(x, y);
                } else {
                    itemIcon(assets.mainItem(packed++), x, y);
                }
            }
            int trinketX = COL_ITEMS + cells.size() * (ITEM_ICON_SIZE + ITEM_SPACING) + TRINKET_GAP;
            if (items.trinket().isEmpty()) {
                emptySlot(trinketX, y);
            } else {
                itemIcon(assets.trinket(), trinketX, y);
            }
            if (items.roleItem().isPresent()) {
                itemIcon(assets.roleItem(), trinketX + ITEM_ICON_SIZE + ITEM_SPACING, y);
            }
        }

        private void itemIcon(Optional<Path> path, int x, int y) {
            icon(path, x, y, ITEM_ICON_SIZE, BROKEN_ITEM, BROKEN_ITEM);
        }

        private void emptySlot(int x, int y) {
            fill(EMPTY_SLOT_FILL, x, y, ITEM_ICON_SIZE, ITEM_ICON_SIZE);
            g.setColor(EMPTY_SLOT_BORDER);
            g.drawRect(x, y, ITEM_ICON_SIZE - 1, ITEM_ICON_SIZE - 1);
        }

        /**
         * Draws the icon at {@code path}, or a flat tile when there is no file ({@code missing}) or it
         * does not decode ({@code broken}).
         */
        private void icon(Optional<Path> path, int x, int y, int size, Color missing, Color broken) {
            if (path.isEmpty()) {
                fill(missing, x, y, size, size);
                return;
            }
            Optional<BufferedImage> image = decoded.computeIfAbsent(path.get(), Canvas::decode);
            if (image.isPresent()) {
                g.drawImage(image.get(), x, y, size, size, null);
            } else {
                fill(broken, x, y, size, size);
            }
        }

        private static Optional<BufferedImage> decode(Path path) {
            try {
                return Optional.ofNullable(ImageIO.read(path.toFile()));
            } catch (IOException e) {
                DebugLog.log("[ScoreboardRenderer] Could not decode " + path + ": " + e.getMessage());
                return Optional.empty();
            }
        }

        private void fill(Color color, int x, int y, int w, int h) {
            g.setColor(color);
            g.fillRect(x, y, w, h);
        }

        private void text(String value, Font font, Color color, int x, int top) {
            g.setFont(font);
            g.setColor(color);
            g.drawString(value, x, top + g.getFontMetrics().getAscent());
        }
    }
}
