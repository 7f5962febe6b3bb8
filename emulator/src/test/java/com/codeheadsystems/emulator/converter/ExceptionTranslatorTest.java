package com.codeheadsystems.emulator.converter;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.emulator.exception.ConditionalCheckFailedException;
import com.codeheadsystems.emulator.exception.ExpressionParseException;
import com.codeheadsystems.emulator.exception.TableAlreadyExistsException;
import com.codeheadsystems.emulator.exception.TableNotFoundException;
import com.codeheadsystems.emulator.exception.UnresolvedPlaceholderException;
import com.codeheadsystems.emulator.exception.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.ResourceInUseException;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;

class ExceptionTranslatorTest {

  private ExceptionTranslator translator;

  @BeforeEach
  void setup() {
    translator = new ExceptionTranslator();
  }

  @Test
  void translate_tableNotFound() {
    final TableNotFoundException cause = new TableNotFoundException("Requested resource not found: Table: t not found");

    final DynamoDbException result = translator.translate(cause);

    assertThat(result).isInstanceOf(ResourceNotFoundException.class).hasCause(cause);
    assertThat(result.statusCode()).isEqualTo(400);
    assertThat(result.awsErrorDetails().errorCode()).isEqualTo("ResourceNotFoundException");
    assertThat(result.awsErrorDetails().errorMessage()).isEqualTo(cause.getMessage());
  }

  @Test
  void translate_tableExists() {
    assertThat(translator.translate(new TableAlreadyExistsException("Table already exists: t")))
        .isInstanceOf(ResourceInUseException.class);
  }

  @Test
  void translate_conditionalCheckFailed() {
    assertThat(translator.translate(new ConditionalCheckFailedException("The conditional request failed")))
        .isInstanceOf(software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException.class);
  }

  @Test
  void translate_validationErrors() {
    final DynamoDbException validation = translator.translate(new ValidationException("bad"));
    final DynamoDbException parse = translator.translate(new ExpressionParseException("Syntax error", "=", 3));
    final DynamoDbException placeholder = translator.translate(new UnresolvedPlaceholderException(":v"));

    assertThat(validation.awsErrorDetails().errorCode()).isEqualTo(ExceptionTranslator.VALIDATION_EXCEPTION);
    assertThat(parse.awsErrorDetails().errorCode()).isEqualTo(ExceptionTranslator.VALIDATION_EXCEPTION);
    assertThat(placeholder.awsErrorDetails().errorCode()).isEqualTo(ExceptionTranslator.VALIDATION_EXCEPTION);
    assertThat(validation.awsErrorDetails().errorMessage()).isEqualTo("bad");
  }
}
