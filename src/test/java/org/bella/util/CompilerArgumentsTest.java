package org.bella.util;

import org.bella.Stage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CompilerArgumentsTest
{
	@AfterEach
	void resetDebug()
	{
		Debug.ENABLE_DEBUG = false;
	}

	@Test
	void no_arguments_shows_help()
	{
		var args = CompilerArguments.parse(new String[0]);
		assertTrue(args.isHelpFlag());
		assertFalse(args.isInvalid());
	}

	@Test
	void defaults_to_optimized_output_on_stdout()
	{
		var args = CompilerArguments.parse(new String[]{"prog.bella"});
		assertEquals(List.of(Paths.get("prog.bella")), args.getInputFiles());
		assertEquals(Stage.OPTIMIZED, args.getStage());
		assertNull(args.getOutputPath());
		assertFalse(args.isCheckOnly());
	}

	@Test
	void parses_all_options()
	{
		var args = CompilerArguments.parse(new String[]{"-v", "--emit=analyzed", "-o", "out/tree.json", "-k", "prog.bella"});
		assertTrue(args.isVerboseFlag());
		assertTrue(Debug.ENABLE_DEBUG);
		assertTrue(args.isCheckOnly());
		assertEquals(Stage.ANALYZED, args.getStage());
		assertEquals(Paths.get("out/tree.json"), args.getOutputPath());
		assertEquals(List.of(Paths.get("prog.bella")), args.getInputFiles());
	}

	@Test
	void help_and_version_short_circuit()
	{
		assertTrue(CompilerArguments.parse(new String[]{"prog.bella", "--help"}).isHelpFlag());
		assertTrue(CompilerArguments.parse(new String[]{"--version", "-x"}).isVersionFlag());
	}

	@Test
	void unknown_option_is_invalid()
	{
		var args = CompilerArguments.parse(new String[]{"--frobnicate", "prog.bella"});
		assertTrue(args.isHelpFlag());
		assertTrue(args.isInvalid());
	}

	@Test
	void missing_output_value_is_invalid()
	{
		assertTrue(CompilerArguments.parse(new String[]{"prog.bella", "-o"}).isInvalid());
		assertTrue(CompilerArguments.parse(new String[]{"-o", "-k", "prog.bella"}).isInvalid());
	}

	@Test
	void unknown_stage_is_invalid()
	{
		assertTrue(CompilerArguments.parse(new String[]{"--emit=js", "prog.bella"}).isInvalid());
	}

	@Test
	void second_input_file_is_invalid()
	{
		assertTrue(CompilerArguments.parse(new String[]{"a.bella", "b.bella"}).isInvalid());
	}
}
