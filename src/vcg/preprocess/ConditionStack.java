package vcg.preprocess;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Nesting state of <code>`ifdef</code> chains. Each frame records whether a branch of its chain has been taken
 * and whether the current branch is live.
 */
class ConditionStack {
  private static class Frame {
    boolean matched;
    boolean active;

    Frame(boolean condition) {
      this.matched = condition;
      this.active = condition;
    }
  }

  private final Deque<Frame> frames = new ArrayDeque<>();

  /** <code>`ifdef</code> / <code>`ifndef</code>: opens a chain whose first branch is live iff the condition holds. */
  void push(boolean condition) { frames.push(new Frame(condition)); }

  /**
   * <code>`elsif</code>: the condition is only considered if no earlier branch matched.
   * @return false if there is no open chain
   */
  boolean elsif(boolean condition) {
    Frame top = frames.peek();
    if (top == null)
      return false;
    if (top.matched) {
      top.active = false;
    } else {
      top.active = condition;
      top.matched = condition;
    }
    return true;
  }

  /**
   * <code>`else</code>: live iff no earlier branch matched.
   * @return false if there is no open chain
   */
  boolean otherwise() {
    Frame top = frames.peek();
    if (top == null)
      return false;
    top.active = !top.matched;
    top.matched = true;
    return true;
  }

  /** @return false if there is no open chain */
  boolean pop() { return frames.poll() != null; }

  /** True iff every open frame is in a live branch; an empty stack is live. */
  boolean isLive() {
    for (Frame frame : frames) {
      if (!frame.active)
        return false;
    }
    return true;
  }

  int depth() { return frames.size(); }
}
