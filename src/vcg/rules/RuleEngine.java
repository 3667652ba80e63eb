package vcg.rules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import vcg.ast.PortDirection;
import vcg.frontend.ParseContext;
import vcg.signature.PortInfo;

/**
 * Ordered signal, parameter and wire rules of one generation unit.
 * <p>
 * Rules of a class are tried from the most recently added to the oldest; the first match wins.
 * Targets may use <code>*</code> for captured groups and <code>${...}</code> for string transforms
 * (see {@link FunctionInterpreter}). A resolved value of exactly <code>0</code> or <code>1</code> is expanded to
 * the port's width (see {@link WidthLiteral}).
 * <p>
 * Resolution does not change any state; only adding rules and {@link #reset()} do.
 */
public class RuleEngine {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private static final Pattern FUNCTION_CALL = Pattern.compile("\\$\\{([^}]+)\\}");

  public enum RuleClass {
    Signal("signal_rules"),
    Param("param_rules"),
    Wire("wire_rules");

    public final String serialName;

    private RuleClass(String serialName) { this.serialName = serialName; }
  }

  private final ParseContext context;
  private final List<SignalRule> signalRules = new ArrayList<>();
  private final List<ParamRule> paramRules = new ArrayList<>();
  private final List<WireRule> wireRules = new ArrayList<>();

  public RuleEngine() { this(new ParseContext("rules")); }

  /** @param context receives function evaluation warnings */
  public RuleEngine(ParseContext context) { this.context = context; }

  //// Adding rules

  /**
   * @param sourcePattern port name pattern
   * @param targetPattern connected signal, may contain <code>*</code>, <code>${...}</code> and inline comments
   * @param direction only apply to ports of this direction; null for all
   */
  public SignalRule addSignalRule(String sourcePattern, String targetPattern, PortDirection direction) {
    SignalRule rule = new SignalRule(WildcardPattern.compile(sourcePattern), InlineComments.extract(requireText(targetPattern, "target")),
                                     direction, signalRules.size());
    signalRules.add(rule);
    logger.debug("Added signal rule {}", rule);
    return rule;
  }

  public SignalRule addSignalRule(String sourcePattern, String targetPattern) { return addSignalRule(sourcePattern, targetPattern, null); }

  public ParamRule addParamRule(String namePattern, String value) {
    ParamRule rule = new ParamRule(WildcardPattern.compile(namePattern), requireText(value, "value"), paramRules.size());
    paramRules.add(rule);
    logger.debug("Added parameter rule {}", rule);
    return rule;
  }

  /**
   * @param portPattern port name pattern
   * @param wirePattern wire name target, may contain <code>*</code>, <code>${...}</code> and inline comments
   * @param width width override, or null
   * @param expression assigned expression, may contain <code>*</code> and <code>${...}</code>; or null
   */
  public WireRule addWireRule(String portPattern, String wirePattern, String width, String expression) {
    WireRule rule = new WireRule(WildcardPattern.compile(portPattern), InlineComments.extract(requireText(wirePattern, "wire pattern")),
                                 (width == null || width.isBlank()) ? null : width.strip(),
                                 (expression == null || expression.isBlank()) ? null : InlineComments.extract(expression), wireRules.size());
    wireRules.add(rule);
    logger.debug("Added wire rule {}", rule);
    return rule;
  }

  private static String requireText(String text, String what) {
    if (text == null)
      throw new IllegalArgumentException("Rule " + what + " must not be null");
    return text;
  }

  /** Removes all rules. */
  public void reset() {
    int total = signalRules.size() + paramRules.size() + wireRules.size();
    signalRules.clear();
    paramRules.clear();
    wireRules.clear();
    logger.debug("Reset all rules (cleared {} rules)", total);
  }

  /** Number of rules per class. */
  public Map<RuleClass, Integer> summary() {
    LinkedHashMap<RuleClass, Integer> counts = new LinkedHashMap<>();
    counts.put(RuleClass.Signal, signalRules.size());
    counts.put(RuleClass.Param, paramRules.size());
    counts.put(RuleClass.Wire, wireRules.size());
    return Collections.unmodifiableMap(counts);
  }

  public List<SignalRule> getSignalRules() { return Collections.unmodifiableList(signalRules); }
  public List<ParamRule> getParamRules() { return Collections.unmodifiableList(paramRules); }
  public List<WireRule> getWireRules() { return Collections.unmodifiableList(wireRules); }

  //// Resolution

  /** Signal connected to the port, or the port name if no rule matches. */
  public String resolveSignal(PortInfo port) {
    for (int i = signalRules.size() - 1; i >= 0; --i) {
      SignalRule rule = signalRules.get(i);
      if (rule.direction() != null && port.direction() != null && rule.direction() != port.direction())
        continue;
      Optional<List<String>> groups = rule.source().match(port.name());
      if (groups.isEmpty())
        continue;
      String result = finishTarget(substitute(rule.target().text(), groups.get()), rule.target().comments(), port);
      logger.trace("Signal rule #{} maps port '{}' to '{}'", rule.index(), port.name(), result);
      return result;
    }
    return port.name();
  }

  /** Override value for the parameter, or empty if no rule matches. */
  public Optional<String> resolveParam(String paramName) {
    for (int i = paramRules.size() - 1; i >= 0; --i) {
      ParamRule rule = paramRules.get(i);
      if (rule.name().matches(paramName)) {
        logger.trace("Parameter rule #{} sets {} = {}", rule.index(), paramName, rule.value());
        return Optional.of(rule.value());
      }
    }
    return Optional.empty();
  }

  /**
   * Wire for the port. Without a matching rule the name is the port name for {@link FillPolicy#Greedy} and
   * empty for {@link FillPolicy#Lazy}.
   */
  public WireResolution resolveWire(PortInfo port, FillPolicy policy) {
    for (int i = wireRules.size() - 1; i >= 0; --i) {
      WireRule rule = wireRules.get(i);
      Optional<List<String>> groups = rule.port().match(port.name());
      if (groups.isEmpty())
        continue;
      String name = finishTarget(substitute(rule.wire().text(), groups.get()), rule.wire().comments(), port);
      String expression = null;
      if (rule.expression() != null)
        expression = InlineComments.restore(substitute(rule.expression().text(), groups.get()), rule.expression().comments());
      logger.debug("Wire rule #{} matched port '{}': name='{}', width='{}', expression='{}'", rule.index(), port.name(), name,
                   rule.width(), expression);
      return new WireResolution(name, rule.width(), expression, true);
    }
    if (policy == FillPolicy.Lazy)
      return new WireResolution("", null, null, false);
    return new WireResolution(port.name(), null, null, false);
  }

  //// Substitution

  /**
   * Evaluates <code>${...}</code> calls and replaces the remaining <code>*</code> of the target, left to right,
   * with the captured groups. Text produced by a call is not searched for <code>*</code>.
   */
  String substitute(String target, List<String> groups) {
    StringBuilder result = new StringBuilder();
    int nextGroup = 0;
    int start = 0;
    Matcher call = FUNCTION_CALL.matcher(target);
    while (true) {
      boolean found = call.find();
      int literalEnd = found ? call.start() : target.length();
      for (int i = start; i < literalEnd; ++i) {
        char c = target.charAt(i);
        if (c == '*' && nextGroup < groups.size())
          result.append(groups.get(nextGroup++));
        else
          result.append(c);
      }
      if (!found)
        break;
      result.append(evaluateCall(call.group(1), call.group(0), groups));
      start = call.end();
    }
    return result.toString();
  }

  private String evaluateCall(String expression, String rawText, List<String> groups) {
    try {
      return new FunctionInterpreter(groups).evaluate(expression);
    } catch (FunctionCallException e) {
      String fallback = groups.isEmpty() ? rawText : groups.get(0);
      context.warning(0, 0, "Function call execution failed: '" + expression + "', " + e.getMessage() + "; using '" + fallback + "'");
      return fallback;
    }
  }

  /** Applies width literal expansion and restores the inline comments. */
  private static String finishTarget(String substituted, List<String> comments, PortInfo port) {
    String value = InlineComments.strip(substituted).strip();
    if (WidthLiteral.isExpandable(value)) {
      String literal = WidthLiteral.expand(port, value);
      return comments.isEmpty() ? literal : literal + " " + InlineComments.render(comments);
    }
    return InlineComments.restore(substituted, comments);
  }
}
