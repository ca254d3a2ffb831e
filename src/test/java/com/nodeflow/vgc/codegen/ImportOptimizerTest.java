package com.nodeflow.vgc.codegen;

import org.junit.Test;

import static org.junit.Assert.*;

public class ImportOptimizerTest {
    private final ImportOptimizer optimizer = new ImportOptimizer();

    @Test
    public void testHoistsAndSortsTopLevelImports() {
        String code = "x = 1\nimport sys\nfrom os import path\nimport abc\n\n\n\ny = 2";

        assertEquals("from os import path\nimport abc\nimport sys\n\nx = 1\n\ny = 2", optimizer.optimize(code));
    }

    @Test
    public void testIndentedImportsAreHoisted() {
        assertEquals("import os\n\ndef f():\n    return os",
                optimizer.optimize("def f():\n    import os\n    return os"));
    }

    @Test
    public void testEmptiedBlockGetsPass() {
        assertEquals("import json\nimport os\n\ndef f():\n    pass\nx = 1",
                optimizer.optimize("def f():\n    import os\n    import json\nx = 1"));
        // docstring keeps the body alive
        assertEquals("import os\n\ndef g():\n    \"\"\"Doc.\"\"\"",
                optimizer.optimize("def g():\n    \"\"\"Doc.\"\"\"\n    import os"));
    }

    @Test
    public void testDuplicateImportsMerged() {
        assertEquals("import os\n\ndef f():\n    return os",
                optimizer.optimize("import os\ndef f():\n    import os\n    return os"));
    }

    @Test
    public void testImportsOnlyHaveNoTrailingBlank() {
        assertEquals("import os", optimizer.optimize("import os"));
        assertEquals("import os\nimport sys", optimizer.optimize("import sys\n\nimport os\n"));
    }

    @Test
    public void testNoImportsOnlyCollapsesBlanks() {
        assertEquals("a\n\nb", optimizer.optimize("a  \n\n\n\nb"));
        assertEquals("important = 1", optimizer.optimize("important = 1"));
    }
}
