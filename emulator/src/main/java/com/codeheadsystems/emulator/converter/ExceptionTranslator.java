package com.codeheadsystems.emulator.converter;

import com.codeheadsystems.emulator.exception.ConditionalCheckFailedException;
import com.codeheadsystems.emulator.exception.EmulatorException;
import com.codeheadsystems.emulator.exception.TableAlreadyExistsException;
import com.codeheadsystems.emulator.exception.TableNotFoundException;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.ResourceInUseException;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;

/**
 * Maps emulator exceptions onto the exceptions a real DynamoDB client throws.
 */
@Singleton
public class ExceptionTranslator {

  /**
   * Error code of client side validation failures.
   */
  public static final String VALIDATION_EXCEPTION = "ValidationException";

  private static final Logger log = LoggerFactory.getLogger(ExceptionTranslator.class);
  private static final String SERVICE_NAME = "DynamoDb";
  private static final int BAD_REQUEST = 400;

  /**
   * Instantiates a new Exception translator.
   */
  @Inject
  public ExceptionTranslator() {
    log.info("ExceptionTranslator()");
  }

  /**
   * Translate the exception.
   *
   * @param e the emulator exception
   * @return the sdk exception to throw
   */
  public DynamoDbException translate(final EmulatorException e) {
    log.debug("translate({})", e.getMessage());
    if (e instanceof TableNotFoundException) {
      return ResourceNotFoundException.builder()
          .message(e.getMessage())
          .statusCode(BAD_REQUEST)
          .awsErrorDetails(details("ResourceNotFoundException", e))
          .cause(e)
          .build();
    }
    if (e instanceof TableAlreadyExistsException) {
      return ResourceInUseException.builder()
          .message(e.getMessage())
          .statusCode(BAD_REQUEST)
          .awsErrorDetails(details("ResourceInUseException", e))
          .cause(e)
          .build();
    }
    if (e instanceof ConditionalCheckFailedException) {
      return software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException.builder()
          .message(e.getMessage())
          .statusCode(BAD_REQUEST)
          .awsErrorDetails(details("ConditionalCheckFailedException", e))
          .cause(e)
          .build();
    }
    // parse, validation, placeholder and type errors are all reported as validation errors
    return (DynamoDbException) DynamoDbException.builder()
        .message(e.getMessage())
        .statusCode(BAD_REQUEST)
        .awsErrorDetails(details(VALIDATION_EXCEPTION, e))
        .cause(e)
        .build();
  }

  private AwsErrorDetails details(final String errorCode, final EmulatorException e) {
    return AwsErrorDetails.builder()
        .errorCode(errorCode)
        .errorMessage(e.getMessage())
        .serviceName(SERVICE_NAME)
        .build();
  }
}
