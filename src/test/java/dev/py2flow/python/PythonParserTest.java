package dev.py2flow.python;

import dev.py2flow.python.PyExpr.Attribute;
import dev.py2flow.python.PyExpr.Call;
import dev.py2flow.python.PyExpr.Constant;
import dev.py2flow.python.PyExpr.ListExpr;
import dev.py2flow.python.PyExpr.Name;
import dev.py2flow.python.PyExpr.Subscript;
import dev.py2flow.python.PyStmt.Assign;
import dev.py2flow.python.PyStmt.ExprStmt;
import dev.py2flow.python.PyStmt.For;
import dev.py2flow.python.PyStmt.FunctionDef;
import dev.py2flow.python.PyStmt.Import;
import dev.py2flow.python.PyStmt.Invalid;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PythonParserTest {

    @Test
    void parsesImportsWithAliases() {
        PyModule module = PythonParser.parse("""
            import pandas as pd
            from sklearn.model_selection import train_test_split, KFold as KF
            """);

        assertThat(module.body()).hasSize(2);
        var plain = (Import) module.body().get(0);
        assertThat(plain.module()).isNull();
        assertThat(plain.names().get(0).boundName()).isEqualTo("pd");

        var from = (Import) module.body().get(1);
        assertThat(from.module()).isEqualTo("sklearn.model_selection");
        assertThat(from.names()).extracting(PyStmt.Alias::boundName).containsExactly("train_test_split", "KF");
    }

    @Test
    void parsesMethodChainWithKeywords() {
        PyModule module = PythonParser.parse("df = pd.read_csv('data/customers.csv', sep=';')\n");

        var assign = (Assign) module.body().get(0);
        assertThat(assign.targets()).singleElement().isInstanceOf(Name.class);
        var call = (Call) assign.value();
        var func = (Attribute) call.func();
        assertThat(((Name) func.value()).id()).isEqualTo("pd");
        assertThat(func.attr()).isEqualTo("read_csv");
        assertThat(((Constant) call.argument(0, "filepath_or_buffer")).value()).isEqualTo("data/customers.csv");
        assertThat(((Constant) call.keyword("sep")).value()).isEqualTo(";");
    }

    @Test
    void parsesSubscriptsWithListIndex() {
        PyModule module = PythonParser.parse("subset = df[['a', 'b']]\n");

        var subscript = (Subscript) ((Assign) module.body().get(0)).value();
        assertThat(subscript.index()).isInstanceOf(ListExpr.class);
        assertThat(((ListExpr) subscript.index()).elements()).hasSize(2);
    }

    @Test
    void keepsSourceTextOfNodes() {
        String source = "df = df[df['age'] > 30]\n";
        PyModule module = PythonParser.parse(source);

        var assign = (Assign) module.body().get(0);
        assertThat(module.text(assign.value())).isEqualTo("df[df['age'] > 30]");
        assertThat(module.text(assign)).isEqualTo("df = df[df['age'] > 30]");
    }

    @Test
    void parsesCompoundStatements() {
        PyModule module = PythonParser.parse("""
            def clean(frame, column):
                return frame.dropna(subset=[column])

            for name in ['a', 'b']:
                print(name)
            """);

        assertThat(module.body()).hasSize(2);
        var def = (FunctionDef) module.body().get(0);
        assertThat(def.name()).isEqualTo("clean");
        assertThat(def.params()).containsExactly("frame", "column");
        var loop = (For) module.body().get(1);
        assertThat(loop.body()).singleElement().isInstanceOf(ExprStmt.class);
    }

    @Test
    void recoversFromBrokenStatement() {
        PyModule module = PythonParser.parse("""
            a = 1
            b = = 2
            c = 3
            """);

        assertThat(module.body()).hasSize(3);
        assertThat(module.body().get(1)).isInstanceOf(Invalid.class);
        assertThat(module.body().get(1).span().line()).isEqualTo(2);
        assertThat(module.body().get(2)).isInstanceOf(Assign.class);
    }

    @Test
    void decodesEscapesButNotRawStrings() {
        PyModule module = PythonParser.parse("""
            a = 'x\\ty'
            b = r'x\\ty'
            """);

        assertThat(((Constant) ((Assign) module.body().get(0)).value()).value()).isEqualTo("x\ty");
        assertThat(((Constant) ((Assign) module.body().get(1)).value()).value()).isEqualTo("x\\ty");
    }
}
