package com.eyelevel.codeconverter.encoder;

import com.eyelevel.codeconverter.model.CodeType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Finds the {@link Encoder} for a code type among all encoders in the application context.
 */
@Service
@Slf4j
public class EncoderFactory {

    private final List<Encoder> encoders;

    public EncoderFactory(List<Encoder> encoders) {
        this.encoders = List.copyOf(encoders);
        log.info("EncoderFactory initialized with {} available encoders.", encoders.size());
    }

    /**
     * @return The first encoder supporting the code type, or empty if none does.
     */
    public Optional<Encoder> getEncoder(CodeType codeType) {
        Optional<Encoder> encoder = encoders.stream()
                .filter(e -> e.supports(codeType))
                .findFirst();
        log.debug("Searching for encoder for code type '{}'. Found: {}", codeType,
                  encoder.map(e -> e.getClass().getSimpleName()).orElse("None"));
        return encoder;
    }
}
