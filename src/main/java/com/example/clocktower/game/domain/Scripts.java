package com.example.clocktower.game.domain;

import java.util.List;

import static com.example.clocktower.game.domain.Character.*;

public final class Scripts {

    public static final Script TROUBLE_BREWING = new Script(
            "Trouble Brewing",
            List.of(WASHERWOMAN, LIBRARIAN, INVESTIGATOR, CHEF, EMPATH, FORTUNE_TELLER, UNDERTAKER,
                    MONK, RAVENKEEPER, VIRGIN, SLAYER, SOLDIER, MAYOR),
            List.of(BUTLER, DRUNK, RECLUSE, SAINT),
            List.of(POISONER, SPY, SCARLET_WOMAN, BARON),
            List.of(IMP),
            List.of(POISONER, SPY, WASHERWOMAN, LIBRARIAN, INVESTIGATOR, CHEF, EMPATH, FORTUNE_TELLER, BUTLER),
            List.of(POISONER, MONK, SPY, IMP, RAVENKEEPER, UNDERTAKER, EMPATH, FORTUNE_TELLER, BUTLER),
            List.of(SOLDIER, RECLUSE, SAINT, BUTLER, DRUNK, VIRGIN, SLAYER, CHEF, WASHERWOMAN, LIBRARIAN,
                    INVESTIGATOR, UNDERTAKER, RAVENKEEPER, MONK, EMPATH, FORTUNE_TELLER));

    private Scripts() {
    }
}
