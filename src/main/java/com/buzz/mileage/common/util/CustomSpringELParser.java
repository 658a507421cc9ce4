package com.buzz.mileage.common.util;

import org.springframework.expression.ExpressionParser;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.StandardEvaluationContext;

/**
 * 어노테이션에 선언된 SpEL 키를 메서드 인자로 평가
 */
public class CustomSpringELParser {

    private static final ExpressionParser PARSER = new SpelExpressionParser();

    private CustomSpringELParser() {
    }

    /**
     * @param parameterNames 메서드 파라미터 이름 (컴파일 시 -parameters 필요)
     * @param args 실제 인자
     * @param key SpEL 식
     * @return 평가된 키 문자열
     */
    public static String resolveKey(String[] parameterNames, Object[] args, String key) {
        StandardEvaluationContext context = new StandardEvaluationContext();
        for (int i = 0; i < parameterNames.length; i++) {
            context.setVariable(parameterNames[i], args[i]);
        }

        Object value = PARSER.parseExpression(key).getValue(context, Object.class);
        if (value == null) {
            throw new IllegalArgumentException("락 키가 null 로 평가되었습니다: " + key);
        }
        return value.toString();
    }
}
