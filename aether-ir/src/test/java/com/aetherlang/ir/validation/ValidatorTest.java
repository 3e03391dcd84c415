package com.aetherlang.ir.validation;

import com.aetherlang.ir.TestPrograms;
import com.aetherlang.ir.mir.MirBuilder;
import com.aetherlang.ir.mir.MirFunction;
import com.aetherlang.ir.mir.MirTerminator;
import com.aetherlang.ir.mir.MirType;
import com.aetherlang.ir.mir.Operand;
import com.aetherlang.ir.mir.Rvalue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.aetherlang.ir.TestPrograms.i64;
import static org.assertj.core.api.Assertions.*;

@DisplayName("Validator 测试")
class ValidatorTest {

    private Validator validator;

    @BeforeEach
    void setUp() {
        validator = new Validator();
    }

    private static List<ValidationError.Kind> kinds(List<ValidationError> errors) {
        List<ValidationError.Kind> result = new ArrayList<>();
        for (ValidationError e : errors) result.add(e.getKind());
        return result;
    }

    @Nested
    @DisplayName("错误")
    class Errors {

        @Test
        @DisplayName("可达块缺少终止指令")
        void testMissingTerminator() {
            List<ValidationError> errors = validator.validate(TestPrograms.missingTerminator());

            assertThat(kinds(errors)).containsExactly(ValidationError.Kind.MISSING_TERMINATOR);
            assertThat(errors.get(0).isError()).isTrue();
            assertThat(errors.get(0).getFunction()).isEqualTo("broken");
        }

        @Test
        @DisplayName("使用未声明的局部变量")
        void testUndefinedLocal() {
            MirBuilder b = new MirBuilder();
            b.startFunction("f", MirType.ofI64());
            b.assign(b.getReturnLocal(), Rvalue.use(Operand.copy(42)));
            b.returnValue();

            List<ValidationError> errors = validator.validate(b.finish());
            assertThat(kinds(errors)).contains(ValidationError.Kind.UNDEFINED_LOCAL);
            assertThat(errors.get(0).getLocal()).isEqualTo(42);
        }

        @Test
        @DisplayName("跳向不存在的块")
        void testInvalidEdge() {
            MirFunction fn = TestPrograms.constantReturn("f", 1);
            fn.getEntry().setTerminator(MirTerminator.goTo(9));

            assertThat(kinds(validator.validate(fn))).containsExactly(ValidationError.Kind.INVALID_EDGE);
        }

        @Test
        @DisplayName("布尔变量被赋值为整数常量")
        void testTypeMismatch() {
            MirBuilder b = new MirBuilder();
            b.startFunction("f", MirType.ofUnit());
            int flag = b.newLocal("flag", MirType.ofBool());
            b.assign(flag, Rvalue.use(i64(1)));
            b.returnValue();

            List<ValidationError> errors = validator.validate(b.finish());
            assertThat(kinds(errors)).containsExactly(ValidationError.Kind.TYPE_MISMATCH);
            assertThat(errors.get(0).getLocal()).isEqualTo(flag);
        }
    }

    @Nested
    @DisplayName("提示")
    class Observations {

        @Test
        @DisplayName("循环变量的多次赋值只是提示")
        void testMultipleAssignment() {
            ValidationReport report = validator.validate(TestPrograms.programOf(TestPrograms.countedSum()));

            assertThat(report.isValid()).isTrue();
            assertThat(report.getErrors()).isEmpty();
            assertThat(kinds(report.getObservations())).containsOnly(ValidationError.Kind.MULTIPLE_ASSIGNMENT);
        }

        @Test
        @DisplayName("不可达块")
        void testUnreachableBlock() {
            MirBuilder b = new MirBuilder();
            b.startFunction("f", MirType.ofUnit());
            int orphan = b.newBlock();
            b.returnValue();
            b.switchToBlock(orphan);
            b.returnValue();

            List<ValidationError> errors = validator.validate(b.finish());
            assertThat(kinds(errors)).containsExactly(ValidationError.Kind.UNREACHABLE_CODE);
            assertThat(errors.get(0).getBlock()).isEqualTo(orphan);
            assertThat(errors.get(0).isError()).isFalse();
        }

        @Test
        @DisplayName("赋值前读取")
        void testUninitializedRead() {
            MirBuilder b = new MirBuilder();
            b.startFunction("f", MirType.ofI64());
            int x = b.newLocal("x", MirType.ofI64());
            b.assign(b.getReturnLocal(), Rvalue.use(Operand.copy(x)));
            b.returnValue();

            List<ValidationError> errors = validator.validate(b.finish());
            assertThat(kinds(errors)).containsExactly(ValidationError.Kind.UNINITIALIZED_LOCAL);
            assertThat(errors.get(0).getLocal()).isEqualTo(x);
        }
    }

    @Test
    @DisplayName("合法函数没有任何结果，且校验不修改函数")
    void testCleanFunction() {
        MirFunction fn = TestPrograms.diamond();
        String before = fn.toString();

        assertThat(validator.validate(TestPrograms.constantReturn("f", 1))).isEmpty();
        assertThat(validator.validate(fn)).noneMatch(ValidationError::isError);
        assertThat(fn.toString()).isEqualTo(before);
    }
}
