package dqfd.replay;

// Where a transition came from. Selects the destination pool on append and
// the pool a priority update goes back to.
public enum Origin {
    // Self-generated interaction, stored in the bounded agent pool.
    AGENT,
    // Expert demonstration, stored persistently in the demo pool.
    DEMO
}
