package vcg.rules;

/**
 * Result of resolving a port against the wire rules.
 * @param name wire name, possibly with comments; the port name or "" if no rule matched
 * @param width width override of the matching rule, or null
 * @param expression assigned expression of the matching rule, or null
 * @param matched whether a rule matched
 */
public record WireResolution(String name, String width, String expression, boolean matched) {}
