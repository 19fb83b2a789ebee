package com.msst.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "msst")
public class MsstProperties {

    private Discovery discovery = new Discovery();
    private Validation validation = new Validation();

    public Discovery getDiscovery() { return discovery; }
    public void setDiscovery(Discovery discovery) { this.discovery = discovery; }
    public Validation getValidation() { return validation; }
    public void setValidation(Validation validation) { this.validation = validation; }

    public static class Discovery {
        private String basePackage = "com.msst.tests";
        private Map<String, GroupRange> groups = defaultGroups();

        public String getBasePackage() { return basePackage; }
        public void setBasePackage(String basePackage) { this.basePackage = basePackage; }
        public Map<String, GroupRange> getGroups() { return groups; }
        public void setGroups(Map<String, GroupRange> groups) { this.groups = groups; }

        private static Map<String, GroupRange> defaultGroups() {
            var groups = new LinkedHashMap<String, GroupRange>();
            groups.put("basic", new GroupRange(1, 99));
            groups.put("multipart", new GroupRange(100, 199));
            groups.put("versioning", new GroupRange(200, 299));
            groups.put("acl", new GroupRange(300, 399));
            groups.put("encryption", new GroupRange(400, 499));
            groups.put("lifecycle", new GroupRange(500, 599));
            groups.put("performance", new GroupRange(600, 699));
            groups.put("stress", new GroupRange(700, 799));
            groups.put("compatibility", new GroupRange(800, 899));
            return groups;
        }
    }

    public static class GroupRange {
        private int start;
        private int end;

        public GroupRange() {}

        public GroupRange(int start, int end) {
            this.start = start;
            this.end = end;
        }

        public int getStart() { return start; }
        public void setStart(int start) { this.start = start; }
        public int getEnd() { return end; }
        public void setEnd(int end) { this.end = end; }
    }

    public static class Validation {
        private int timeoutSeconds = 300;
        private String criticalSuite = "critical";
        private List<String> quickSuites = new ArrayList<>(List.of("critical", "error_handling"));
        private String javaCommand = "";
        private boolean useDefaultSuites = true;
        private Map<String, SuiteSpec> suites = new LinkedHashMap<>();

        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
        public String getCriticalSuite() { return criticalSuite; }
        public void setCriticalSuite(String criticalSuite) { this.criticalSuite = criticalSuite; }
        public List<String> getQuickSuites() { return quickSuites; }
        public void setQuickSuites(List<String> quickSuites) { this.quickSuites = quickSuites; }
        public String getJavaCommand() { return javaCommand; }
        public void setJavaCommand(String javaCommand) { this.javaCommand = javaCommand; }
        public Map<String, SuiteSpec> getSuites() { return suites; }
        public void setSuites(Map<String, SuiteSpec> suites) { this.suites = suites; }
        public boolean isUseDefaultSuites() { return useDefaultSuites; }
        public void setUseDefaultSuites(boolean useDefaultSuites) { this.useDefaultSuites = useDefaultSuites; }

        /** The shipped suite table, used when no suites are configured. */
        public static Map<String, SuiteSpec> defaultSuites() {
            var suites = new LinkedHashMap<String, SuiteSpec>();
            suites.put("critical", new SuiteSpec("Critical Data Integrity",
                    List.of("004", "005", "006"), 100, "Data integrity and corruption prevention"));
            suites.put("error_handling", new SuiteSpec("Error Handling & Recovery",
                    List.of("011", "012"), 100, "Network timeouts and retry logic"));
            suites.put("multipart", new SuiteSpec("Multipart Operations",
                    List.of("100", "101", "102"), 100, "Large file handling and multipart uploads"));
            suites.put("versioning", new SuiteSpec("Versioning Support",
                    List.of("200"), 80, "Object versioning capabilities"));
            suites.put("performance", new SuiteSpec("Performance Benchmarks",
                    List.of("600", "601"), 90, "Throughput and latency requirements"));
            return suites;
        }
    }

    public static class SuiteSpec {
        private String name = "";
        private List<String> tests = new ArrayList<>();
        private double requiredPassRate = 100;
        private String description = "";

        public SuiteSpec() {}

        public SuiteSpec(String name, List<String> tests, double requiredPassRate, String description) {
            this.name = name;
            this.tests = new ArrayList<>(tests);
            this.requiredPassRate = requiredPassRate;
            this.description = description;
        }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public List<String> getTests() { return tests; }
        public void setTests(List<String> tests) { this.tests = tests; }
        public double getRequiredPassRate() { return requiredPassRate; }
        public void setRequiredPassRate(double requiredPassRate) { this.requiredPassRate = requiredPassRate; }
        public String getDescription() { return description; }
        public void setDescription(String description) { this.description = description; }
    }
}
