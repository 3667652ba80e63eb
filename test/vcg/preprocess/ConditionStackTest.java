package vcg.preprocess;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class ConditionStackTest {

  @Test
  void testElsifChain() {
    ConditionStack stack = new ConditionStack();
    stack.push(false);
    Assertions.assertFalse(stack.isLive());
    Assertions.assertTrue(stack.elsif(true));
    Assertions.assertTrue(stack.isLive());
    Assertions.assertTrue(stack.elsif(true));
    // a later branch never activates once one matched
    Assertions.assertFalse(stack.isLive());
    Assertions.assertTrue(stack.otherwise());
    Assertions.assertFalse(stack.isLive());
    Assertions.assertTrue(stack.pop());
    Assertions.assertEquals(0, stack.depth());
  }

  @Test
  void testInactiveParentMasksChildren() {
    ConditionStack stack = new ConditionStack();
    stack.push(false);
    stack.push(true);
    Assertions.assertFalse(stack.isLive());
    stack.otherwise();
    Assertions.assertFalse(stack.isLive());
  }

  @Test
  void testUnbalanced() {
    ConditionStack stack = new ConditionStack();
    Assertions.assertFalse(stack.pop());
    Assertions.assertFalse(stack.otherwise());
    Assertions.assertFalse(stack.elsif(true));
    Assertions.assertTrue(stack.isLive());
  }
}
