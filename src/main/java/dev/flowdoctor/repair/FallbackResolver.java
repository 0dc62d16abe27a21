package dev.flowdoctor.repair;

import dev.flowdoctor.model.FlowDocument;
import dev.flowdoctor.model.SystemNodes;

import java.util.Set;

/**
 * Picks replacement targets for references that point nowhere.
 */
public final class FallbackResolver {

    private FallbackResolver() {}

    /**
     * Return-to-menu node if present, else the main menu, else the existing id numerically nearest
     * to the missing one (lower wins a tie), else the generic error node. The source node itself
     * is never chosen.
     */
    public static int forOrphan(Set<Integer> ids, int source, int missing) {
        for (int menu : new int[] {SystemNodes.RETURN_TO_MENU, SystemNodes.MAIN_MENU}) {
            if (menu != source && ids.contains(menu)) {
                return menu;
            }
        }
        int best = SystemNodes.ERROR_MESSAGE;
        long bestDistance = Long.MAX_VALUE;
        for (int id : ids) {
            if (id == source) {
                continue;
            }
            long distance = Math.abs((long) id - missing);
            if (distance < bestDistance || (distance == bestDistance && id < best)) {
                best = id;
                bestDistance = distance;
            }
        }
        return best;
    }

    /** Menu node if present, else the generic error node. For destinations that are not ids at all. */
    public static int forInvalid(Set<Integer> ids, int source) {
        for (int menu : new int[] {SystemNodes.RETURN_TO_MENU, SystemNodes.MAIN_MENU}) {
            if (menu != source && ids.contains(menu)) {
                return menu;
            }
        }
        return SystemNodes.ERROR_MESSAGE;
    }

    /** Menu node if present, else the entry node. Used for "back to menu" recovery buttons. */
    public static int menuOrEntry(Set<Integer> ids, int source) {
        for (int menu : new int[] {SystemNodes.RETURN_TO_MENU, SystemNodes.MAIN_MENU}) {
            if (menu != source && ids.contains(menu)) {
                return menu;
            }
        }
        return FlowDocument.ENTRY_NODE;
    }
}
