module org.irscan.analyzer.recursion.common {
    requires transitive com.google.common;

    exports org.irscan.analyzer.recursion.common;
    exports org.irscan.analyzer.recursion.common.graph;
    exports org.irscan.analyzer.recursion.common.ir;
}
