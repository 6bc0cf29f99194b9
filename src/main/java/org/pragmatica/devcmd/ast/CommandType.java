package org.pragmatica.devcmd.ast;

/**
 * Command variants. A watch and a stop command may share a name: together they describe the
 * start and stop halves of one long-running service.
 */
public enum CommandType {
    COMMAND,
    WATCH,
    STOP
}
