package org.unbundle.splitter.frontend.extract;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class ChunkExtractorTest {

    private final ChunkExtractor extractor = new ChunkExtractor();

    @Test
    void extractsChunkIdGlobalAndModuleMap() {
        Optional<ExtractedChunk> chunk = extractor.extract(
                "(self.webpackChunkapp=self.webpackChunkapp||[]).push([[12],{1:function(e){}}]);");

        assertThat(chunk).isPresent();
        assertThat(chunk.get().chunkId()).isEqualTo(12);
        assertThat(chunk.get().globalName()).isEqualTo("webpackChunkapp");
        assertThat(chunk.get().moduleMapSource()).isEqualTo("{1:function(e){}}");
        assertThat(chunk.get().wrappedModuleMapSource()).isEqualTo("({1:function(e){}}, 0)");
    }

    @Test
    void toleratesFormattingAndLeadingCode() {
        String source = """
                "use strict";
                ( self.webpackChunkmy_app = self.webpackChunkmy_app || [ ] ).push( [
                  [ 345 ],
                  {
                    10: function (e, t, n) { n(11); }
                  }
                ] );
                """;

        Optional<ExtractedChunk> chunk = extractor.extract(source);

        assertThat(chunk).isPresent();
        assertThat(chunk.get().chunkId()).isEqualTo(345);
        assertThat(chunk.get().globalName()).isEqualTo("webpackChunkmy_app");
        assertThat(chunk.get().moduleMapSource()).startsWith("{").endsWith("}").contains("n(11)");
    }

    @Test
    void keepsRuntimeCallbackInsideModuleMapSource() {
        Optional<ExtractedChunk> chunk = extractor.extract(
                "(self.webpackChunkapp=self.webpackChunkapp||[]).push([[3],{1:function(e){}},function(e){e(1)}]);");

        assertThat(chunk).isPresent();
        assertThat(chunk.get().moduleMapSource()).startsWith("{1:function(e){}}").endsWith("function(e){e(1)}");
    }

    @Test
    void rejectsMismatchedGlobalNames() {
        assertThat(extractor.extract(
                "(self.webpackChunka=self.webpackChunkb||[]).push([[1],{1:function(e){}}]);")).isEmpty();
    }

    @Test
    void rejectsTextWithoutWrapper() {
        assertThat(extractor.extract("console.log('hello');")).isEmpty();
        assertThat(extractor.extract("")).isEmpty();
        assertThat(extractor.extract(null)).isEmpty();
    }

    @Test
    void rejectsChunkIdOutOfIntRange() {
        assertThat(extractor.extract(
                "(self.webpackChunkapp=self.webpackChunkapp||[]).push([[99999999999],{1:function(e){}}]);")).isEmpty();
    }
}
