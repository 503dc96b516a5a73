/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.pyparse.parser;

import static org.junit.Assert.assertEquals;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.pyparse.ast.AstDump;
import exm.pyparse.ast.Module;
import exm.pyparse.ast.Stmt;
import exm.pyparse.common.Logging;
import exm.pyparse.common.exceptions.InvalidSyntaxException;
import exm.pyparse.frontend.ParsedModule;

public class ExpressionParserTest {

  private static final String X = "Name(id='x', ctx=Load())";
  private static final String Y = "Name(id='y', ctx=Load())";

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/ExpressionParserTest.pyparse.log", true);
  }

  /**
   * Parse a single expression statement and dump the expression
   */
  static String expr(String source) throws InvalidSyntaxException {
    Module m = ParsedModule.parseSource(source);
    assertEquals(1, m.body.size());
    return AstDump.dump(((Stmt.ExprStmt) m.body.get(0)).value);
  }

  @Test
  public void testPrecedence() throws Exception {
    assertEquals("BinOp(left=Constant(value=1), op=Add(), " +
        "right=BinOp(left=Constant(value=2), op=Mult(), " +
        "right=Constant(value=3)))", expr("1 + 2 * 3"));
    assertEquals("BinOp(left=BinOp(left=Constant(value=1), op=Sub(), " +
        "right=Constant(value=2)), op=Sub(), right=Constant(value=3))",
        expr("1 - 2 - 3"));
    assertEquals("BinOp(left=Name(id='a', ctx=Load()), op=BitOr(), " +
        "right=BinOp(left=Name(id='b', ctx=Load()), op=BitAnd(), " +
        "right=BinOp(left=Name(id='c', ctx=Load()), op=LShift(), " +
        "right=Constant(value=1))))", expr("a | b & c << 1"));
  }

  @Test
  public void testPowerRightAssociative() throws Exception {
    assertEquals("BinOp(left=Constant(value=2), op=Pow(), " +
        "right=BinOp(left=Constant(value=3), op=Pow(), " +
        "right=Constant(value=2)))", expr("2 ** 3 ** 2"));
    assertEquals("UnaryOp(op=USub(), operand=BinOp(left=" + X +
        ", op=Pow(), right=Constant(value=2)))", expr("-x ** 2"));
    assertEquals("BinOp(left=Constant(value=2), op=Pow(), " +
        "right=UnaryOp(op=USub(), operand=Constant(value=1)))",
        expr("2 ** -1"));
  }

  @Test
  public void testChainedComparison() throws Exception {
    assertEquals("Compare(left=Constant(value=0), ops=[Lt(), Lt()], " +
        "comparators=[" + X + ", Constant(value=10)])",
        expr("0 < x < 10"));
    assertEquals("Compare(left=Name(id='a', ctx=Load()), " +
        "ops=[NotIn(), IsNot()], comparators=[Name(id='b', ctx=Load()), " +
        "Name(id='c', ctx=Load())])", expr("a not in b is not c"));
  }

  @Test
  public void testBoolOps() throws Exception {
    assertEquals("BoolOp(op=Or(), values=[Name(id='a', ctx=Load()), " +
        "BoolOp(op=And(), values=[Name(id='b', ctx=Load()), " +
        "UnaryOp(op=Not(), operand=Name(id='c', ctx=Load()))])])",
        expr("a or b and not c"));
    assertEquals("BoolOp(op=And(), values=[Name(id='a', ctx=Load()), " +
        "Name(id='b', ctx=Load()), Name(id='c', ctx=Load())])",
        expr("a and b and c"));
  }

  @Test
  public void testConditionalAndLambda() throws Exception {
    assertEquals("IfExp(test=Name(id='b', ctx=Load()), " +
        "body=Name(id='a', ctx=Load()), orelse=Name(id='c', ctx=Load()))",
        expr("a if b else c"));
    assertEquals("Lambda(args=arguments(posonlyargs=[], " +
        "args=[arg(arg='x')], vararg=arg(arg='a'), " +
        "kwonlyargs=[arg(arg='y')], kw_defaults=[Constant(value=1)], " +
        "kwarg=arg(arg='k'), defaults=[]), body=" + X + ")",
        expr("lambda x, *a, y=1, **k: x"));
    assertEquals("Lambda(args=arguments(posonlyargs=[], args=[], " +
        "kwonlyargs=[], kw_defaults=[], defaults=[]), " +
        "body=Constant(value=None))", expr("lambda: None"));
  }

  @Test
  public void testSubscripts() throws Exception {
    assertEquals("Subscript(value=" + X + ", slice=Slice(" +
        "lower=Constant(value=1), upper=Constant(value=2)), ctx=Load())",
        expr("x[1:2]"));
    assertEquals("Subscript(value=" + X + ", slice=Tuple(" +
        "elts=[Constant(value=1), Constant(value=2)], ctx=Load()), " +
        "ctx=Load())", expr("x[1,2]"));
    assertEquals("Subscript(value=" + X + ", slice=Slice(" +
        "step=Constant(value=2)), ctx=Load())", expr("x[::2]"));
    assertEquals("Subscript(value=" + X + ", slice=Tuple(elts=[" +
        "Slice(lower=Constant(value=1)), Starred(value=" + Y +
        ", ctx=Load())], ctx=Load()), ctx=Load())", expr("x[1:, *y]"));
    assertEquals("Subscript(value=" + X + ", slice=Tuple(elts=[" +
        "Starred(value=" + Y + ", ctx=Load())], ctx=Load()), ctx=Load())",
        expr("x[*y]"));
  }

  @Test
  public void testCalls() throws Exception {
    assertEquals("Call(func=Name(id='f', ctx=Load()), args=[" +
        "Name(id='a', ctx=Load()), Starred(value=Name(id='b', ctx=Load())" +
        ", ctx=Load())], keywords=[keyword(arg='c', " +
        "value=Constant(value=1)), keyword(value=Name(id='d', " +
        "ctx=Load()))])", expr("f(a, *b, c=1, **d)"));
    assertEquals("Call(func=Name(id='f', ctx=Load()), args=[], " +
        "keywords=[])", expr("f()"));
  }

  @Test
  public void testGeneratorArgument() throws Exception {
    assertEquals("Call(func=Name(id='f', ctx=Load()), args=[" +
        "GeneratorExp(elt=" + X + ", generators=[comprehension(" +
        "target=Name(id='x', ctx=Store()), iter=" + Y + ", ifs=[], " +
        "is_async=0)])], keywords=[])", expr("f(x for x in y)"));
  }

  @Test
  public void testComprehensions() throws Exception {
    assertEquals("ListComp(elt=" + X + ", generators=[comprehension(" +
        "target=Name(id='x', ctx=Store()), iter=" + Y + ", ifs=[], " +
        "is_async=0)])", expr("[x for x in y]"));
    assertEquals("List(elts=[" + X + ", " + Y + "], ctx=Load())",
        expr("[x, y]"));
    assertEquals("SetComp(elt=" + X + ", generators=[comprehension(" +
        "target=Name(id='x', ctx=Store()), iter=" + Y + ", ifs=[" + X +
        "], is_async=0)])", expr("{x for x in y if x}"));
    assertEquals("DictComp(key=Name(id='k', ctx=Load()), value=" +
        "Name(id='v', ctx=Load()), generators=[comprehension(target=" +
        "Tuple(elts=[Name(id='k', ctx=Store()), Name(id='v', " +
        "ctx=Store())], ctx=Store()), iter=" + Y + ", ifs=[], " +
        "is_async=0)])", expr("{k: v for k, v in y}"));
  }

  @Test
  public void testDisplays() throws Exception {
    assertEquals("Dict(keys=[Constant(value=1), None], values=[" +
        "Constant(value=2), Name(id='m', ctx=Load())])",
        expr("{1: 2, **m}"));
    assertEquals("Dict(keys=[], values=[])", expr("{}"));
    assertEquals("Set(elts=[Name(id='a', ctx=Load()), " +
        "Name(id='b', ctx=Load())])", expr("{a, b}"));
    assertEquals("Tuple(elts=[], ctx=Load())", expr("()"));
    assertEquals("Tuple(elts=[Constant(value=1)], ctx=Load())",
        expr("(1,)"));
    assertEquals("Constant(value=1)", expr("(1)"));
    assertEquals("Tuple(elts=[Constant(value=1), Constant(value=2)], " +
        "ctx=Load())", expr("1, 2"));
  }

  @Test
  public void testAttributesAndNamedExpr() throws Exception {
    assertEquals("Attribute(value=Attribute(value=Name(id='a', " +
        "ctx=Load()), attr='b', ctx=Load()), attr='c', ctx=Load())",
        expr("a.b.c"));
    assertEquals("NamedExpr(target=Name(id='y', ctx=Store()), " +
        "value=Constant(value=10))", expr("(y := 10)"));
    assertEquals("Await(value=" + X + ")", expr("await x"));
  }

  @Test
  public void testConstants() throws Exception {
    assertEquals("Constant(value=31)", expr("0x1F"));
    assertEquals("Constant(value=1000)", expr("1_000"));
    assertEquals("Constant(value=1500.0)", expr("1.5e3"));
    assertEquals("Constant(value=2j)", expr("2j"));
    assertEquals("Constant(value=Ellipsis)", expr("..."));
    assertEquals("Constant(value=True)", expr("True"));
  }

  @Test
  public void testStringConcatenation() throws Exception {
    assertEquals("Constant(value='ab')", expr("'a' \"b\""));
    assertEquals("Constant(value='x', kind='u')", expr("u'x'"));
    assertEquals("Constant(value=b'ab')", expr("b'a' b'b'"));
    assertEquals("Constant(value='a\\\\nb')", expr("r'a\\nb'"));
    assertEquals("Constant(value='a\\\\nb')", expr("'a\\\\nb'"));
    assertEquals("Constant(value='tab\\t')", expr("'tab\\t'"));
  }

  @Test
  public void testNestedFString() throws Exception {
    assertEquals("JoinedStr(values=[FormattedValue(value=BinOp(" +
        "left=Name(id='a', ctx=Load()), op=Add(), right=JoinedStr(" +
        "values=[FormattedValue(value=Name(id='b', ctx=Load()), " +
        "conversion=-1)])), conversion=-1)])",
        expr("f\"{a + f'{b}'}\""));
  }

  @Test
  public void testSingleQuotedFStrings() throws Exception {
    assertEquals("JoinedStr(values=[Constant(value='hello')])",
                 expr("f'hello'"));
    assertEquals("JoinedStr(values=[FormattedValue(value=" + X +
                 ", conversion=-1)])", expr("f\"{x}\""));
    assertEquals("JoinedStr(values=[Constant(value='\\\\n'), " +
        "FormattedValue(value=" + X + ", conversion=-1)])",
        expr("rf\"\\n{x}\""));
    assertEquals("JoinedStr(values=[Constant(value='\\n'), " +
        "FormattedValue(value=" + X + ", conversion=-1)])",
        expr("F'\\n{x}'"));
    assertEquals("TemplateStr(values=[Interpolation(value=" + X +
        ", str='x', conversion=-1)])", expr("t'{x}'"));
  }

  @Test
  public void testFStringFields() throws Exception {
    assertEquals("JoinedStr(values=[FormattedValue(value=" + X +
        ", conversion=114, format_spec=JoinedStr(values=[" +
        "Constant(value='>10')]))])", expr("f'{x!r:>10}'"));
    assertEquals("JoinedStr(values=[Constant(value='x='), " +
        "FormattedValue(value=" + X + ", conversion=114)])",
        expr("f'{x=}'"));
    assertEquals("JoinedStr(values=[Constant(value='a{b}')])",
        expr("f'a{{b}}'"));
    assertEquals("JoinedStr(values=[Constant(value='ab'), " +
        "FormattedValue(value=" + X + ", conversion=-1)])",
        expr("'a' f'b{x}'"));
  }
}
