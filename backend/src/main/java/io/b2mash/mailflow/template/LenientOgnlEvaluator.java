package io.b2mash.mailflow.template;

import ognl.ExpressionSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.thymeleaf.context.IExpressionContext;
import org.thymeleaf.standard.expression.IStandardVariableExpression;
import org.thymeleaf.standard.expression.IStandardVariableExpressionEvaluator;
import org.thymeleaf.standard.expression.OGNLVariableExpressionEvaluator;
import org.thymeleaf.standard.expression.StandardExpressionExecutionContext;

/**
 * OGNL evaluator that resolves unreachable values (a missing key, a property of a null parent, an
 * index past the end of a list) to {@code null}, which renders as empty output. OGNL syntax errors
 * still propagate so a broken template is reported instead of silently blanked.
 */
class LenientOgnlEvaluator implements IStandardVariableExpressionEvaluator {

  private static final Logger log = LoggerFactory.getLogger(LenientOgnlEvaluator.class);

  static final LenientOgnlEvaluator INSTANCE = new LenientOgnlEvaluator();

  private final OGNLVariableExpressionEvaluator delegate =
      new OGNLVariableExpressionEvaluator(true);

  @Override
  public Object evaluate(
      IExpressionContext context,
      IStandardVariableExpression expression,
      StandardExpressionExecutionContext expContext) {
    try {
      return delegate.evaluate(context, expression, expContext);
    } catch (RuntimeException e) {
      if (isSyntaxError(e)) {
        throw e;
      }
      log.debug(
          "Expression '{}' did not resolve, rendering empty: {}",
          expression.getExpression(),
          e.getMessage());
      return null;
    }
  }

  private static boolean isSyntaxError(Throwable error) {
    for (Throwable t = error; t != null; t = t.getCause()) {
      if (t instanceof ExpressionSyntaxException) {
        return true;
      }
    }
    return false;
  }
}
