package works.jsonkeep.jackson;

import java.nio.charset.Charset;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;
import tools.jackson.databind.json.JsonMapper;

import static java.nio.charset.StandardCharsets.UTF_8;
import static tools.jackson.databind.DeserializationFeature.FAIL_ON_TRAILING_TOKENS;

@Value
@Builder(toBuilder = true)
public class JsonKeepSettings {
	/**
	 * Used to read and write files.
	 */
	@Default Charset charset = UTF_8;

	/**
	 * Does the actual decoding and encoding.
	 * <p>
	 * The default rejects anything after the first JSON value, as a strict JSON parser should.
	 * Features that change the structure of the output, such as
	 * {@link tools.jackson.databind.SerializationFeature#INDENT_OUTPUT INDENT_OUTPUT},
	 * apply only to values with no detected indentation.
	 */
	@Default JsonMapper mapper = strictMapper();

	public static JsonKeepSettings defaults() {
		return DEFAULTS;
	}

	private static JsonMapper strictMapper() {
		return JsonMapper.builder()
			.enable(FAIL_ON_TRAILING_TOKENS)
			.build();
	}

	private static final JsonKeepSettings DEFAULTS = JsonKeepSettings.builder().build();
}
