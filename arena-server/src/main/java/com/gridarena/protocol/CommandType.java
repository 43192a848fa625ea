package com.gridarena.protocol;

/**
 * Commands a client can send, one per line:
 * - MOVE &lt;direction&gt;: step one cell UP, DOWN, LEFT or RIGHT
 * - ATTACK: hit every player in an orthogonally adjacent cell
 * - QUIT: leave the game
 *
 * Anything else parses as UNKNOWN.
 */
public enum CommandType {
    MOVE,
    ATTACK,
    QUIT,
    UNKNOWN
}
