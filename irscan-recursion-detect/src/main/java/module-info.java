module org.irscan.analyzer.recursion.detect {
    requires org.irscan.analyzer.recursion.common;
    requires org.slf4j;

    exports org.irscan.analyzer.recursion.detect;
    exports org.irscan.analyzer.recursion.detect.callgraph;
}
