// Copyright (c) 2001-2014 Genome Research Ltd.
//
// Authors: David Harper
//          Ed Zuiderwijk
//          Kate Taylor
//
// This file is part of RnaFold.
//
// RnaFold is free software: you can redistribute it and/or modify it under
// the terms of the GNU General Public License as published by the Free Software
// Foundation; either version 3 of the License, or (at your option) any later
// version.
//
// This program is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// this program. If not, see <http://www.gnu.org/licenses/>.

package uk.ac.sanger.rnafold.utils;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;

import uk.ac.sanger.rnafold.RnaFold;
import uk.ac.sanger.rnafold.io.ResultWriter;
import uk.ac.sanger.rnafold.io.SequenceFileReader;
import uk.ac.sanger.rnafold.io.TablePrinter;
import uk.ac.sanger.rnafold.nussinov.FoldingException;
import uk.ac.sanger.rnafold.nussinov.FoldingResult;
import uk.ac.sanger.rnafold.nussinov.OutputMode;
import uk.ac.sanger.rnafold.nussinov.StructurePredictor;
import uk.ac.sanger.rnafold.pairing.PairingModel;
import uk.ac.sanger.rnafold.pairing.PairingModels;
import uk.ac.sanger.rnafold.pairing.StackedPairModel;

public class RunStructurePrediction {
	public static final String DEFAULT_SEQUENCE_FILE = "sequence.txt";
	public static final String DEFAULT_OUTPUT_FILE = "output.txt";
	public static final int DEFAULT_GAP = 0;

	public static final String SEQUENCE_FILE_KEY = "rnafold.sequence.file";
	public static final String OUTPUT_FILE_KEY = "rnafold.output.file";
	public static final String MODEL_KEY = "rnafold.model";
	public static final String GAP_KEY = "rnafold.gap";
	public static final String PRINT_TABLE_KEY = "rnafold.stacked.printtable";

	public static final int EXIT_USAGE = 1;
	public static final int EXIT_FAILURE = 2;

	private String sequenceFilename;
	private String outputFilename;
	private PairingModel model;
	private int gap;
	private boolean writeAnnotation;
	private boolean printTable;
	private boolean help = false;

	public static void main(String[] args) {
		RunStructurePrediction runner = null;

		try {
			runner = parseArguments(args);
		} catch (IllegalArgumentException iae) {
			System.err.println(iae.getMessage());
			System.err.println();
			printUsage(System.err);
			System.exit(EXIT_USAGE);
		}

		if (runner.isHelp()) {
			printUsage(System.out);
			System.exit(0);
		}

		System.exit(runner.run(System.out));
	}

	public static RunStructurePrediction parseArguments(String[] args) {
		RunStructurePrediction runner = new RunStructurePrediction();

		String modelName = RnaFold.getProperty(MODEL_KEY, PairingModels.FLAT);
		String gapText = null;
		Boolean annotation = null;
		Boolean table = null;

		runner.sequenceFilename = RnaFold.getProperty(SEQUENCE_FILE_KEY,
				DEFAULT_SEQUENCE_FILE);
		runner.outputFilename = RnaFold.getProperty(OUTPUT_FILE_KEY,
				DEFAULT_OUTPUT_FILE);

		for (int i = 0; i < args.length; i++) {
			if (args[i].equalsIgnoreCase("-sequence"))
				runner.sequenceFilename = getValue(args, ++i);
			else if (args[i].equalsIgnoreCase("-output"))
				runner.outputFilename = getValue(args, ++i);
			else if (args[i].equalsIgnoreCase("-model"))
				modelName = getValue(args, ++i);
			else if (args[i].equalsIgnoreCase("-energy"))
				modelName = parseEnergy(getValue(args, ++i));
			else if (args[i].equalsIgnoreCase("-gap"))
				gapText = getValue(args, ++i);
			else if (args[i].equalsIgnoreCase("-annotation"))
				annotation = Boolean.TRUE;
			else if (args[i].equalsIgnoreCase("-noannotation"))
				annotation = Boolean.FALSE;
			else if (args[i].equalsIgnoreCase("-table"))
				table = Boolean.TRUE;
			else if (args[i].equalsIgnoreCase("-notable"))
				table = Boolean.FALSE;
			else if (args[i].equalsIgnoreCase("-help"))
				runner.help = true;
			else
				throw new IllegalArgumentException("Unknown option: " + args[i]);
		}

		runner.model = PairingModels.fromProperties(RnaFold.getProperties(),
				modelName);

		boolean stacked = runner.model instanceof StackedPairModel;

		if (gapText != null) {
			if (stacked)
				throw new IllegalArgumentException(
						"A gap may only be given with a base-pair model");

			runner.gap = parseGap(gapText);
		} else
			runner.gap = stacked ? DEFAULT_GAP : RnaFold.getInteger(GAP_KEY,
					DEFAULT_GAP);

		if (runner.gap < 0)
			throw new IllegalArgumentException("The gap must not be negative: "
					+ runner.gap);

		runner.writeAnnotation = annotation != null ? annotation.booleanValue()
				: !runner.model.getName().equalsIgnoreCase(PairingModels.ENERGY);

		runner.printTable = table != null ? table.booleanValue() : stacked
				&& RnaFold.getBoolean(PRINT_TABLE_KEY);

		return runner;
	}

	private static String getValue(String[] args, int i) {
		if (i >= args.length)
			throw new IllegalArgumentException("Missing value for option "
					+ args[i - 1]);

		return args[i];
	}

	private static String parseEnergy(String value) {
		if (value.equalsIgnoreCase("true"))
			return PairingModels.ENERGY;
		else if (value.equalsIgnoreCase("false"))
			return PairingModels.FLAT;
		else
			throw new IllegalArgumentException("-energy must be true or false, not "
					+ value);
	}

	private static int parseGap(String value) {
		try {
			return Integer.parseInt(value);
		} catch (NumberFormatException nfe) {
			throw new IllegalArgumentException("The gap must be an integer, not "
					+ value, nfe);
		}
	}

	/**
	 * Reads the sequence, folds it and writes the result file. Returns the
	 * process exit status.
	 */
	public int run(PrintStream ps) {
		try {
			String sequence = new SequenceFileReader().readSequence(new File(
					sequenceFilename));

			RnaFold.logInfo("Folding a sequence of length " + sequence.length()
					+ " from " + sequenceFilename + " using the "
					+ model.getName() + " model with gap " + gap);

			OutputMode mode = writeAnnotation ? OutputMode.ANNOTATED
					: OutputMode.SCORE_ONLY;

			FoldingResult result = StructurePredictor.predict(sequence, model,
					gap, mode);

			if (printTable)
				new TablePrinter().print(result, ps);

			new ResultWriter().write(result, new File(outputFilename));

			RnaFold.logInfo("Wrote score " + result.getScore() + " to "
					+ outputFilename);

			return 0;
		} catch (IOException ioe) {
			RnaFold.logSevere("Failed to fold the sequence in " + sequenceFilename,
					ioe);
			return EXIT_FAILURE;
		} catch (FoldingException fe) {
			RnaFold.logSevere("Failed to fold the sequence in " + sequenceFilename,
					fe);
			return EXIT_FAILURE;
		}
	}

	public String getSequenceFilename() {
		return sequenceFilename;
	}

	public String getOutputFilename() {
		return outputFilename;
	}

	public PairingModel getModel() {
		return model;
	}

	public int getGap() {
		return gap;
	}

	public boolean isWriteAnnotation() {
		return writeAnnotation;
	}

	public boolean isPrintTable() {
		return printTable;
	}

	public boolean isHelp() {
		return help;
	}

	public static void printUsage(PrintStream ps) {
		ps.println("OPTIONAL PARAMETERS WHICH CONTROL INPUT AND OUTPUT");
		ps.println("\t-sequence\tName of the sequence file [default: "
				+ DEFAULT_SEQUENCE_FILE + "]");
		ps.println("\t-output\t\tName of the results file [default: "
				+ DEFAULT_OUTPUT_FILE + "]");
		ps.println();
		ps.println("OPTIONAL PARAMETERS WHICH CONTROL PROCESSING");
		ps.println("\t-model\t\tPairing model: flat, energy, stacked or a model named in the properties [default: flat]");
		ps.println("\t-energy\t\ttrue selects the energy model, false the flat model");
		ps.println("\t-gap\t\tMinimum separation of paired bases, base-pair models only [default: "
				+ DEFAULT_GAP + "]");
		ps.println();
		ps.println("OPTIONAL PARAMETERS WHICH CONTROL OUTPUT");
		ps.println("\t-[no]annotation\tDo [not] write the bracket annotation [default: not for the energy model]");
		ps.println("\t-[no]table\tDo [not] print the DP table");
		ps.println("\t-help\t\tPrint this message");
	}
}
