package org.chessrules.settings;

import lombok.Data;

@Data
public class AppSettings {
    private RulesSettings rules = new RulesSettings();
}
