package io.github.cyfko.qsfilter.core.exception;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FilterExceptionTest {

    @Test
    void columnNotFoundNamesTheColumn() {
        ColumnNotFoundException e = new ColumnNotFoundException("nope");
        assertEquals("nope", e.getField());
        assertTrue(e.getMessage().contains("nope"));
    }

    @Test
    void unsupportedOperatorCarriesTheSymbol() {
        UnsupportedOperatorException e = new UnsupportedOperatorException("age", "between", "unknown operator");
        assertEquals("age", e.getField());
        assertEquals("between", e.getOperator());
    }

    @Test
    void allErrorsShareOneBaseType() {
        assertInstanceOf(FilterException.class, new InvalidParameterException("k", "m"));
        assertInstanceOf(FilterException.class, new ConversionException("k", "m"));
        assertInstanceOf(FilterException.class, new NotMappedException("k", "m"));
        assertInstanceOf(FilterException.class, new MalformedSubqueryException("k", "m"));
        assertInstanceOf(RuntimeException.class, new ColumnNotFoundException("k"));
    }

    @Test
    void causeIsKept() {
        NumberFormatException cause = new NumberFormatException("x");
        assertSame(cause, new ConversionException("k", "m", cause).getCause());
    }
}
