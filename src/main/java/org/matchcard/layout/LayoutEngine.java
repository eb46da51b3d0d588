package org.matchcard.layout;

import org.matchcard.model.Participant;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a participant list into scoreboard geometry. Pure and thread-safe.
 */
public class LayoutEngine {
    private final ScoreboardGeometry geometry;
    private final RowOrder rowOrder;

    public LayoutEngine(ScoreboardGeometry geometry, RowOrder rowOrder) {
        this.geometry = geometry;
        this.rowOrder = rowOrder;
    }

    public ScoreboardLayout layout(List<Participant> participants, String trackedPuuid) {
        List<Participant> winners = orderTeam(participants, true);
        List<Participant> losers = orderTeam(participants, false);

        List<TeamLayout> teams = new ArrayList<>(2);
        int y = geometry.headerHeight();
        TeamLayout winning = layoutTeam(true, winners, y, trackedPuuid);
        teams.add(winning);
        y += geometry.teamHeight(winners.size()) + geometry.teamSpacing();
        teams.add(layoutTeam(false, losers, y, trackedPuuid));

        int height = geometry.imageHeight(winners.size(), losers.size());
        return new ScoreboardLayout(geometry.width(), height, teams);
    }

    /**
     * One team in display order. {@link List#sort} is stable, so equal keys keep input order.
     */
    public List<Participant> orderTeam(List<Participant> participants, boolean victory) {
        List<Participant> team = new ArrayList<>();
        for (Participant p : participants) {
            if (p.win() == victory) {
                team.add(p);
            }
        }
        team.sort(rowOrder.comparator());
        return team;
    }

    private TeamLayout layoutTeam(boolean victory, List<Participant> members, int top, String trackedPuuid) {
        int columnsY = top + geometry.teamHeaderHeight();
        int rowY = columnsY + geometry.columnHeaderHeight();
        List<RowLayout> rows = new ArrayList<>(members.size());
        for (Participant p : members) {
            boolean tracked = trackedPuuid != null && trackedPuuid.equals(p.puuid());
            rows.add(new RowLayout(p, rowY, ItemBar.pack(p, geometry), tracked));
            rowY += geometry.rowHeight();
        }
        return new TeamLayout(victory, top, columnsY, rows);
    }

    public ScoreboardGeometry geometry() {
        return geometry;
    }
}
