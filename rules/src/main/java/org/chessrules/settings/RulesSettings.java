package org.chessrules.settings;

import lombok.Data;

@Data
public class RulesSettings {

    /**
     * When true, a move onto a piece of the mover's own color is never valid. When false the
     * rook, knight, bishop, queen and king validators only check shape and blocking, and the
     * caller is expected to look at the target square.
     */
    private boolean rejectOwnColorTargets = true;

    // Debug-log every validation and generation request made through MoveAdvisor.
    private boolean logQueries = false;

    public RulesSettings copy() {
        RulesSettings copy = new RulesSettings();
        copy.setRejectOwnColorTargets(rejectOwnColorTargets);
        copy.setLogQueries(logQueries);
        return copy;
    }
}
