package io.b2mash.mailflow.template;

import org.thymeleaf.standard.StandardDialect;
import org.thymeleaf.standard.expression.IStandardVariableExpressionEvaluator;

/**
 * Standard dialect whose variable expressions evaluate to nothing when the value they point at is
 * missing, so a template referencing an absent context key still renders.
 */
public class LenientStandardDialect extends StandardDialect {

  @Override
  public IStandardVariableExpressionEvaluator getVariableExpressionEvaluator() {
    return LenientOgnlEvaluator.INSTANCE;
  }
}
