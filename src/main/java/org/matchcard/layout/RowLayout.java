package org.matchcard.layout;

import org.matchcard.model.Participant;

/**
 * @param y top edge of the row in image coordinates
 */
public record RowLayout(Participant participant, int y, ItemBar items, boolean tracked) {
}
