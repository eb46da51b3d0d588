package org.matchcard.layout;

import org.matchcard.model.Participant;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Fixed-width item row: packed main cells, the trinket cell, then an optional role-item cell.
 * Main cells never contain an empty cell before a filled one.
 */
public record ItemBar(List<ItemCell> mainCells, ItemCell trinket, Optional<ItemCell> roleItem) {

    public ItemBar {
        mainCells = List.copyOf(mainCells);
    }

    /**
     * Packs a participant's items into {@code geometry.mainItemSlots()} cells. With seven slots the
     * role-bound item joins the main cells and no role cell is drawn.
     */
    public static ItemBar pack(Participant participant, ScoreboardGeometry geometry) {
        List<Integer> ids = new ArrayList<>(participant.mainItems());
        if (geometry.roleItemInMainSlots()) {
            ids.add(participant.roleBoundItem());
        }
        int slots = geometry.mainItemSlots();
        List<ItemCell> cells = new ArrayList<>(slots);
        for (int id : ids) {
            if (id != 0 && cells.size() < slots) {
                cells.add(ItemCell.of(id));
            }
        }
        while (cells.size() < slots) {
            cells.add(ItemCell.empty());
        }
        Optional<ItemCell> role = !geometry.roleItemInMainSlots() && participant.roleBoundItem() != 0
                ? Optional.of(ItemCell.of(participant.roleBoundItem()))
                : Optional.empty();
        return new ItemBar(cells, ItemCell.of(participant.trinket()), role);
    }

    /** Item ids of the non-empty main cells, left to right. */
    public List<Integer> packedItemIds() {
        List<Integer> ids = new ArrayList<>();
        for (ItemCell cell : mainCells) {
            if (!cell.isEmpty()) {
                ids.add(cell.itemId());
            }
        }
        return ids;
    }

    public int filledMainCells() {
        return packedItemIds().size();
    }

    /**
     * Draw order as the renderer emits it, with {@code gap} marking the spacing before the trinket.
     */
    public List<String> drawOrder() {
        List<String> order = new ArrayList<>();
        mainCells.forEach(cell -> order.add(cell.toString()));
        order.add("gap");
        order.add(trinket.toString());
        roleItem.ifPresent(cell -> order.add(cell.toString()));
        return order;
    }
}
