package com.mcpcheck.core.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlText;
import com.fasterxml.jackson.dataformat.xml.ser.ToXmlGenerator;
import com.mcpcheck.core.plugin.Outcome;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * JUnit-style XML report for CI systems.
 * <p>
 * One {@code <testsuite>} with {@code tests}/{@code failures} counts and one
 * {@code <testcase>} per outcome. {@code classname} is {@value #CLASSNAME_PREFIX} plus the
 * target operation; {@code time} is in seconds with three decimals. Failed and skipped
 * cases carry a {@code <failure>} element whose body is the captured error text.
 */
@Component
public class JUnitXmlReporter implements Reporter {

    static final String SUITE_NAME = "MCP Automated Tests";
    static final String CLASSNAME_PREFIX = "mcp.tools.";

    private final XmlMapper xmlMapper;

    public JUnitXmlReporter() {
        this.xmlMapper = XmlMapper.builder()
                .enable(ToXmlGenerator.Feature.WRITE_XML_DECLARATION)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
                .serializationInclusion(JsonInclude.Include.NON_NULL)
                .build();
    }

    @Override
    public ReportFormat format() {
        return ReportFormat.JUNIT;
    }

    @Override
    public void write(Report report, Writer out) throws IOException {
        xmlMapper.writeValue(out, toSuite(report));
    }

    public String writeToString(Report report) throws IOException {
        return xmlMapper.writeValueAsString(toSuite(report));
    }

    static String seconds(Long durationMs) {
        long ms = durationMs != null ? durationMs : 0L;
        return String.format(Locale.ROOT, "%.3f", ms / 1000.0);
    }

    private TestSuite toSuite(Report report) {
        var suite = new TestSuite();
        suite.name = SUITE_NAME;
        suite.tests = report.summary().total();
        suite.failures = report.summary().failed();
        suite.errors = 0;
        suite.time = seconds(report.summary().durationMs());
        suite.timestamp = report.timestamp() != null ? report.timestamp().toString() : null;

        suite.properties = new ArrayList<>();
        suite.properties.add(new Property("transport", "http"));
        if (report.target() != null) {
            suite.properties.add(new Property("url", report.target()));
        }
        if (report.cancelled()) {
            suite.properties.add(new Property("cancelled", "true"));
        }

        suite.testcases = new ArrayList<>();
        for (Outcome outcome : report.outcomes()) {
            var testCase = new TestCase();
            testCase.name = outcome.pluginName();
            testCase.classname = CLASSNAME_PREFIX + outcome.targetOperation();
            testCase.time = seconds(outcome.durationMs());
            if (!outcome.passed()) {
                testCase.failure = new Failure(outcome.message(), outcome.error());
            }
            suite.testcases.add(testCase);
        }
        return suite;
    }

    @JacksonXmlRootElement(localName = "testsuite")
    @JsonPropertyOrder({"name", "tests", "failures", "errors", "time", "timestamp", "properties", "testcases"})
    static class TestSuite {
        @JacksonXmlProperty(isAttribute = true)
        public String name;
        @JacksonXmlProperty(isAttribute = true)
        public int tests;
        @JacksonXmlProperty(isAttribute = true)
        public int failures;
        @JacksonXmlProperty(isAttribute = true)
        public int errors;
        @JacksonXmlProperty(isAttribute = true)
        public String time;
        @JacksonXmlProperty(isAttribute = true)
        public String timestamp;

        @JacksonXmlElementWrapper(localName = "properties")
        @JacksonXmlProperty(localName = "property")
        public List<Property> properties;

        @JacksonXmlElementWrapper(useWrapping = false)
        @JacksonXmlProperty(localName = "testcase")
        public List<TestCase> testcases;
    }

    static class Property {
        @JacksonXmlProperty(isAttribute = true)
        public String name;
        @JacksonXmlProperty(isAttribute = true)
        public String value;

        Property(String name, String value) {
            this.name = name;
            this.value = value;
        }
    }

    @JsonPropertyOrder({"name", "classname", "time", "failure"})
    static class TestCase {
        @JacksonXmlProperty(isAttribute = true)
        public String name;
        @JacksonXmlProperty(isAttribute = true)
        public String classname;
        @JacksonXmlProperty(isAttribute = true)
        public String time;

        public Failure failure;
    }

    static class Failure {
        @JacksonXmlProperty(isAttribute = true)
        public String message;
        @JacksonXmlText
        public String text;

        Failure(String message, String text) {
            this.message = message;
            this.text = text;
        }
    }
}
