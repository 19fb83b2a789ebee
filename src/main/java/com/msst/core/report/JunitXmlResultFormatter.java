package com.msst.core.report;

import com.msst.core.model.TestResult;
import com.msst.core.model.TestRun;
import com.msst.core.model.TestStatus;
import com.msst.core.model.TestSummary;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * JUnit-style XML for CI systems: one {@code testsuite} per group present in the
 * results (in order of first appearance), one {@code testcase} per result.
 * TIMEOUT results are reported as {@code error} elements.
 */
public class JunitXmlResultFormatter implements ResultFormatter {

    static final String SUITES_NAME = "S3 Interoperability Tests";

    @Override
    public OutputFormat outputFormat() {
        return OutputFormat.JUNIT;
    }

    @Override
    public String format(TestRun run) {
        try {
            Document doc = DocumentBuilderFactory.newInstance().newDocumentBuilder().newDocument();
            Element testsuites = doc.createElement("testsuites");
            testsuites.setAttribute("name", SUITES_NAME);
            testsuites.setAttribute("timestamp", run.timestamp());
            doc.appendChild(testsuites);

            for (Map.Entry<String, List<TestResult>> group : byGroup(run.results()).entrySet()) {
                testsuites.appendChild(testsuite(doc, group.getKey(), group.getValue()));
            }
            return serialize(doc);
        } catch (ParserConfigurationException | TransformerException e) {
            throw new IllegalStateException("Cannot build JUnit XML report", e);
        }
    }

    private static Map<String, List<TestResult>> byGroup(List<TestResult> results) {
        var groups = new LinkedHashMap<String, List<TestResult>>();
        for (TestResult r : results) {
            groups.computeIfAbsent(r.testGroup(), k -> new ArrayList<>()).add(r);
        }
        return groups;
    }

    private static Element testsuite(Document doc, String group, List<TestResult> results) {
        TestSummary summary = TestSummary.of(results);
        double time = results.stream().mapToDouble(TestResult::duration).sum();

        Element suite = doc.createElement("testsuite");
        suite.setAttribute("name", group);
        suite.setAttribute("tests", String.valueOf(summary.total()));
        suite.setAttribute("failures", String.valueOf(summary.failed()));
        suite.setAttribute("errors", String.valueOf(summary.errors()));
        suite.setAttribute("skipped", String.valueOf(summary.skipped()));
        suite.setAttribute("time", seconds(time));

        for (TestResult r : results) {
            Element testcase = doc.createElement("testcase");
            testcase.setAttribute("classname", "s3." + r.testGroup());
            testcase.setAttribute("name", r.testName());
            testcase.setAttribute("time", seconds(r.duration()));

            String child = switch (r.status()) {
                case FAILED -> "failure";
                case ERROR, TIMEOUT -> "error";
                case SKIPPED -> "skipped";
                case PASSED -> null;
            };
            if (child != null) {
                Element detail = doc.createElement(child);
                detail.setAttribute("message", r.message());
                if (r.status() == TestStatus.TIMEOUT) {
                    detail.setAttribute("type", "timeout");
                }
                if (!r.error().isEmpty()) {
                    detail.setTextContent(r.error());
                }
                testcase.appendChild(detail);
            }
            suite.appendChild(testcase);
        }
        return suite;
    }

    private static String seconds(double value) {
        return String.format(Locale.ROOT, "%.3f", value);
    }

    private static String serialize(Document doc) throws TransformerException {
        Transformer transformer = TransformerFactory.newInstance().newTransformer();
        transformer.setOutputProperty(OutputKeys.INDENT, "yes");
        transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
        transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");
        var out = new StringWriter();
        transformer.transform(new DOMSource(doc), new StreamResult(out));
        return out.toString();
    }
}
