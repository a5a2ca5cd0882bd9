/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.docstore.aggregation.pipeline.expression;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.experimental.UtilityClass;

/** Factory methods for building stage expressions. */
@UtilityClass
public class DSL {

  public static FieldPathExpression field(String path) {
    return new FieldPathExpression(path);
  }

  public static ConstantExpression literal(Object value) {
    return new ConstantExpression(value);
  }

  public static ComputedExpression computed(String operator, Expression... arguments) {
    return new ComputedExpression(operator, Arrays.asList(arguments));
  }

  /**
   * Builds a document expression from alternating name and expression arguments.
   *
   * @param nameAndExpressions name1, expr1, name2, expr2, ...
   * @return document expression
   */
  public static DocumentExpression document(Object... nameAndExpressions) {
    if (nameAndExpressions.length % 2 != 0) {
      throw new IllegalArgumentException("Expected name/expression pairs");
    }
    Map<String, Expression> fields = new LinkedHashMap<>();
    for (int i = 0; i < nameAndExpressions.length; i += 2) {
      fields.put((String) nameAndExpressions[i], (Expression) nameAndExpressions[i + 1]);
    }
    return new DocumentExpression(fields);
  }
}
